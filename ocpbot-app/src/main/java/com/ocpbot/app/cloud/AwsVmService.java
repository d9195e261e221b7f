package com.ocpbot.app.cloud;

import jakarta.annotation.Nullable;

import java.util.List;

/**
 * EC2 operations used by the AWS commands. Provide an implementation as a
 * Spring bean to enable them.
 */
public interface AwsVmService {

    enum Action {
        START, STOP, DELETE
    }

    record CreateRequest(String osName, String instanceType, @Nullable String keyPair) {
    }

    /**
     * @param state filter by instance state, null for all
     * @param type  filter by instance type, null for all
     */
    List<VmInstance> listInstances(String region, @Nullable String state, @Nullable String type);

    VmInstance createInstance(String region, CreateRequest request);

    /**
     * Apply a lifecycle action; returns the instance as it stands afterwards.
     */
    VmInstance modifyInstance(String region, String instanceId, Action action);
}
