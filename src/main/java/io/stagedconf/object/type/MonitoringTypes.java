package io.stagedconf.object.type;

import lombok.experimental.UtilityClass;

/**
 * Object types of a monitoring node.
 */
@UtilityClass
public class MonitoringTypes {
    public static final String HOST = "Host";
    public static final String SERVICE = "Service";
    public static final String COMMENT = "Comment";
    public static final String DOWNTIME = "Downtime";

    public static TypeRegistry createRegistry() {
        final TypeRegistry registry = new TypeRegistry();

        registry.register(ReflectionType.builder(HOST, "Hosts")
                .configField("display_name")
                .configField("address")
                .configField("address6")
                .configField("check_command")
                .configField("check_interval")
                .configField("groups")
                .configField("vars")
                .stateField("last_check")
                .stateField("state")
                .build());

        registry.register(CompositeNameType.compositeBuilder(SERVICE, "Services")
                .namePart("host_name", HOST, true)
                .configField("display_name")
                .requiredField("check_command")
                .configField("check_interval")
                .configField("groups")
                .configField("vars")
                .stateField("last_check")
                .stateField("state")
                .build());

        registry.register(CompositeNameType.compositeBuilder(COMMENT, "Comments")
                .namePart("host_name", HOST, true)
                .namePart("service_name", SERVICE, false)
                .requiredField("author")
                .requiredField("text")
                .configField("entry_type")
                .configField("entry_time")
                .configField("expire_time")
                .configField("persistent")
                .build());

        registry.register(CompositeNameType.compositeBuilder(DOWNTIME, "Downtimes")
                .namePart("host_name", HOST, true)
                .namePart("service_name", SERVICE, false)
                .requiredField("author")
                .requiredField("comment")
                .requiredField("start_time")
                .requiredField("end_time")
                .configField("fixed")
                .configField("duration")
                .configField("entry_time")
                .stateField("trigger_time")
                .build());

        return registry;
    }
}
