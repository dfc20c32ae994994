package com.memoryfetch.memoryfetch.memories;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized download configuration bound from {@code application.properties}.
 * Command line options override the values per run.
 */
@ConfigurationProperties(prefix = "memories")
public class MemoriesProperties {

    private String outputDir = MemoriesConstants.DEFAULT_OUTPUT_DIR;
    private double delay = MemoriesConstants.DEFAULT_DELAY_SECONDS;
    private int maxRetries = MemoriesConstants.DEFAULT_MAX_RETRIES;
    private int concurrency = MemoriesConstants.DEFAULT_CONCURRENCY;
    private int confirmConcurrencyAbove = MemoriesConstants.DEFAULT_CONFIRM_CONCURRENCY_ABOVE;
    private Duration backoffUnit = Duration.ofSeconds(1);
    private Duration connectTimeout = Duration.ofSeconds(20);
    private Duration readTimeout = Duration.ofSeconds(60);
    private String userAgent = MemoriesConstants.DEFAULT_USER_AGENT;
    private String routeHeaderName = MemoriesConstants.DEFAULT_ROUTE_HEADER_NAME;
    private String routeHeaderValue = MemoriesConstants.DEFAULT_ROUTE_HEADER_VALUE;

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public double getDelay() {
        return delay;
    }

    public void setDelay(double delay) {
        this.delay = delay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getConfirmConcurrencyAbove() {
        return confirmConcurrencyAbove;
    }

    public void setConfirmConcurrencyAbove(int confirmConcurrencyAbove) {
        this.confirmConcurrencyAbove = confirmConcurrencyAbove;
    }

    public Duration getBackoffUnit() {
        return backoffUnit;
    }

    public void setBackoffUnit(Duration backoffUnit) {
        this.backoffUnit = backoffUnit;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getRouteHeaderName() {
        return routeHeaderName;
    }

    public void setRouteHeaderName(String routeHeaderName) {
        this.routeHeaderName = routeHeaderName;
    }

    public String getRouteHeaderValue() {
        return routeHeaderValue;
    }

    public void setRouteHeaderValue(String routeHeaderValue) {
        this.routeHeaderValue = routeHeaderValue;
    }
}
