package com.ocpbot.app.cloud;

import jakarta.annotation.Nullable;

import java.util.List;

/**
 * OpenStack compute operations used by the OpenStack commands. Provide an
 * implementation as a Spring bean to enable them.
 */
public interface OpenStackVmService {

    record CreateRequest(String name, String imageId, String flavor, @Nullable String network,
            @Nullable String keyName) {
    }

    List<VmInstance> listServers(String status, @Nullable String flavor, @Nullable String nameFilter);

    VmInstance createServer(CreateRequest request);
}
