package com.ocpbot.app.commands;

import com.ocpbot.common.config.BotConfig;
import com.ocpbot.common.config.ConfigService;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Option lists shown in command help and used to validate arguments.
 * Config-backed lists are read on every call, so help reflects the current
 * config file.
 */
public class CommandChoices {

    public static final List<String> OPENSTACK_STATUSES = List.of("ACTIVE", "SHUTOFF", "ERROR");

    public static final List<String> OPENSTACK_FLAVORS = List.of(
            // m1
            "m1.tiny", "m1.small", "m1.medium", "m1.large", "m1.xlarge",
            // ci
            "ci.cpu.small", "ci.cpu.medium", "ci.cpu.large",
            // general purpose
            "t2.micro", "t2.small", "t2.medium", "t3.micro", "t3.small", "t3.medium",
            // compute optimized
            "c5.large", "c5.xlarge", "c5.2xlarge",
            // memory optimized
            "r5.large", "r5.xlarge",
            // storage optimized
            "i3.large", "i3.xlarge");

    public static final List<String> AWS_INSTANCE_STATES = List.of(
            "pending", "running", "shutting-down", "terminated", "stopping", "stopped");

    // TODO: add m5 types once the team agrees on cost limits for bot-created instances
    public static final List<String> AWS_INSTANCE_TYPES = List.of(
            "t2.micro", "t2.small", "t2.medium", "t3.micro", "t3.small", "t3.medium");

    private final ConfigService configService;

    public CommandChoices(ConfigService configService) {
        this.configService = configService;
    }

    /**
     * OS names from {@code openstack.osImageMap}.
     *
     * @throws IllegalStateException when no image map is configured
     */
    public List<String> openStackOsNames() {
        return new ArrayList<>(osImageMap().keySet());
    }

    public Map<String, String> osImageMap() {
        BotConfig.OpenStackConfig openstack = configService.loadConfig().getOpenstack();
        if (openstack == null || openstack.getOsImageMap() == null || openstack.getOsImageMap().isEmpty()) {
            throw new IllegalStateException("openstack.osImageMap is not configured");
        }
        return openstack.getOsImageMap();
    }
}
