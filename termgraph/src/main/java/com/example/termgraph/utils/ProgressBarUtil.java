package com.example.termgraph.utils;

/**
 * Text progress bars for log output.
 */
public class ProgressBarUtil {

    public static final int DEFAULT_BAR_LENGTH = 30;

    private ProgressBarUtil() {
    }

    /**
     * Renders e.g. {@code [=====     ] 50.0% (5/10)}.
     */
    public static String renderProgressBar(int current, int total, int barLength) {
        if (total <= 0) {
            return "[] 0.0% (0/0)";
        }

        float percent = Math.min(1f, (float) current / total);
        int completedLength = Math.round(barLength * percent);

        StringBuilder bar = new StringBuilder("[");
        for (int i = 0; i < barLength; i++) {
            bar.append(i < completedLength ? "=" : " ");
        }
        bar.append("] ");
        bar.append(String.format("%.1f%%", percent * 100));
        bar.append(String.format(" (%d/%d)", current, total));
        return bar.toString();
    }

    /**
     * How many items to process between two progress lines.
     *
     * @param percentInterval how often to report, in percent
     */
    public static int getUpdateFrequency(int total, int percentInterval) {
        if (total <= 0 || percentInterval <= 0 || percentInterval > 100) {
            return 1;
        }
        int itemsPerPercent = Math.max(1, total / 100);
        return Math.max(1, itemsPerPercent * percentInterval);
    }
}
