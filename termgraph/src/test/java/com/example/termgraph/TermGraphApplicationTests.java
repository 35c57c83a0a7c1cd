package com.example.termgraph;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.MockReset;
import org.springframework.test.context.ActiveProfiles;

import com.example.termgraph.Graph.Service.WriteMode;
import com.example.termgraph.Store.GraphStore;
import com.example.termgraph.Tokenizer.PreIndexer;
import com.example.termgraph.Tokenizer.Tokenizer;
import com.example.termgraph.config.GraphConfig;
import com.example.termgraph.service.DocumentGraphService;
import com.example.termgraph.utils.KeyCodec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
class TermGraphApplicationTests {

	// the runner pings once at startup, keep that invocation across tests
	@MockBean(reset = MockReset.NONE)
	private GraphStore graphStore;

	@Autowired
	private KeyCodec keyCodec;

	@Autowired
	private GraphConfig graphConfig;

	@Autowired
	private Tokenizer tokenizer;

	@Autowired
	private DocumentGraphService documentGraphService;

	@Test
	void contextLoads() {
		assertNotNull(documentGraphService);
		assertTrue(tokenizer instanceof PreIndexer, "default tokenizer should be the stemming pre-indexer");
	}

	@Test
	void graphSettingsComeFromProperties() {
		assertEquals("test", keyCodec.getNamespacePrefix());
		assertEquals(":", keyCodec.getSeparator());
		assertEquals(25, graphConfig.getSearchLimit());
		assertEquals(WriteMode.IMMEDIATE, graphConfig.getWriteMode());
		assertEquals("test:^:d1", keyCodec.contentKey("d1"));
	}

	@Test
	void startupChecksStoreConnection() {
		verify(graphStore).ping();
	}
}
