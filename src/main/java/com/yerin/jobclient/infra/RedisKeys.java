package com.yerin.jobclient.infra;

import com.yerin.jobclient.domain.JobId;

/**
 * Key layout shared with the workers.
 */
public final class RedisKeys {

    private final String prefix;

    public RedisKeys(String prefix) {
        this.prefix = prefix;
    }

    public String job(JobId id) { return prefix + ":job:" + id.value(); }
    public String queue(String name) { return prefix + ":queue:" + name; }
    public String queues() { return prefix + ":queues"; }
    public String canceled(String queueName) { return prefix + ":canceled:" + queueName; }
}
