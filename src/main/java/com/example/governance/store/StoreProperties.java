package com.example.governance.store;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "governance.reliability.store")
public class StoreProperties {

    /** Write one JSONL file per table; otherwise rows are kept in memory only. */
    private boolean jsonlEnabled = false;

    private String directory = "./data/reliability";

    /** Free-text fields (errors, side effects) are clipped to this many characters. */
    private int maxTextChars = 512;

    public boolean isJsonlEnabled() {
        return jsonlEnabled;
    }

    public void setJsonlEnabled(boolean jsonlEnabled) {
        this.jsonlEnabled = jsonlEnabled;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public int getMaxTextChars() {
        return maxTextChars;
    }

    public void setMaxTextChars(int maxTextChars) {
        this.maxTextChars = maxTextChars;
    }
}
