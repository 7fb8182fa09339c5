package com.sprintsync.workflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Tunables under {@code sprintsync.workflow.*} (see application.yml).
 */
@Component
@ConfigurationProperties(prefix = "sprintsync.workflow")
public class WorkflowProperties {

    private Transition transition = new Transition();
    private Cache      cache      = new Cache();

    public Transition getTransition()              { return transition; }
    public void setTransition(Transition t)        { this.transition = t; }
    public Cache getCache()                        { return cache; }
    public void setCache(Cache c)                  { this.cache = c; }

    public static class Transition {

        // Attempts per move when the task row is contended (lock timeout or version clash).
        private int      maxAttempts  = 3;
        private Duration retryBackoff = Duration.ofMillis(25);
        private Duration lockTimeout  = Duration.ofSeconds(3);
        private Duration txTimeout    = Duration.ofSeconds(10);

        public int getMaxAttempts()                { return maxAttempts; }
        public void setMaxAttempts(int v)          { this.maxAttempts = v; }
        public Duration getRetryBackoff()          { return retryBackoff; }
        public void setRetryBackoff(Duration v)    { this.retryBackoff = v; }
        public Duration getLockTimeout()           { return lockTimeout; }
        public void setLockTimeout(Duration v)     { this.lockTimeout = v; }
        public Duration getTxTimeout()             { return txTimeout; }
        public void setTxTimeout(Duration v)       { this.txTimeout = v; }
    }

    public static class Cache {

        private long     maxOrganizations = 10_000;
        private Duration ttl              = Duration.ofMinutes(10);

        public long getMaxOrganizations()          { return maxOrganizations; }
        public void setMaxOrganizations(long v)    { this.maxOrganizations = v; }
        public Duration getTtl()                   { return ttl; }
        public void setTtl(Duration v)             { this.ttl = v; }
    }
}
