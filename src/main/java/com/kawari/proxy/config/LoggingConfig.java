package com.kawari.proxy.config;

/**
 * Access log settings.
 */
public class LoggingConfig {
    /**
     * Line format. Apache-style placeholders (%h, %t, %r, %>s, %b ...) plus
     * %i for the identity, %x for the backend and %a for the attempt count.
     */
    private String format = "%h %l %u %t \"%r\" %>s %b \"%i\" %x %a";

    /** Whether to also write the access log to a file. */
    private boolean fileEnabled = false;

    /** Directory of the access log file. */
    private String filePath = "logs";

    /** Name of the access log file. */
    private String fileName = "kawari-access.log";

    /** Rotation type: DAILY or SIZE. */
    private String rotation = "DAILY";

    /** Size that triggers rotation (e.g. "10MB"). Only used with SIZE. */
    private String maxSize = "10MB";

    /** Max number of archived files to keep. */
    private int maxHistory = 30;

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public boolean isFileEnabled() {
        return fileEnabled;
    }

    public void setFileEnabled(boolean fileEnabled) {
        this.fileEnabled = fileEnabled;
    }

    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public String getRotation() {
        return rotation;
    }

    public void setRotation(String rotation) {
        this.rotation = rotation;
    }

    public String getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(String maxSize) {
        this.maxSize = maxSize;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = maxHistory;
    }
}
