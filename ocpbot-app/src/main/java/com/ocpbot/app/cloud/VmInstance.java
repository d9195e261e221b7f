package com.ocpbot.app.cloud;

import jakarta.annotation.Nullable;
import lombok.Builder;
import lombok.Value;

/**
 * A virtual machine as reported by a cloud collaborator.
 */
@Value
@Builder
public class VmInstance {
    String id;
    @Nullable
    String name;
    @Nullable
    String state;
    /** Instance type or flavor. */
    @Nullable
    String type;
    @Nullable
    String imageId;
    @Nullable
    String keyName;
    @Nullable
    String publicIp;
    @Nullable
    String network;

    /**
     * Multi-line Slack rendering, one field per line.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Instance Name: ").append(orNa(name)).append('\n');
        sb.append("ID: ").append(id).append('\n');
        if (imageId != null) {
            sb.append("Image ID: ").append(imageId).append('\n');
        }
        sb.append("Instance type: ").append(orNa(type)).append('\n');
        if (keyName != null) {
            sb.append("Key name: ").append(keyName).append('\n');
        }
        if (network != null) {
            sb.append("Network: ").append(network).append('\n');
        }
        sb.append("Public IP: ").append(orNa(publicIp)).append('\n');
        sb.append("State: ").append(orNa(state));
        return sb.toString();
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }
}
