package com.example.governance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "governance.reliability.executor")
public class ExecutorProperties {

    /** Threads shared by single-flight recoveries and fan-out calls. */
    private int poolSize = 8;

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }
}
