package com.yerin.jobclient.domain;

import lombok.Getter;

@Getter
public class NoSuchJobException extends RuntimeException {

    private final JobId jobId;

    public NoSuchJobException(JobId jobId) {
        super("No such job: " + jobId);
        this.jobId = jobId;
    }
}
