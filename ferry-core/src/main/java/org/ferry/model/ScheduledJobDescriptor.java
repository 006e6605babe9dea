package org.ferry.model;

import lombok.Builder;
import lombok.Value;

/**
 * A pg_cron job, identified by its name.
 */
@Value
@Builder(toBuilder = true)
public class ScheduledJobDescriptor implements Descriptor {
    String jobName;
    String schedule;
    String command;
    boolean active;

    @Override
    public String key() {
        return jobName;
    }
}
