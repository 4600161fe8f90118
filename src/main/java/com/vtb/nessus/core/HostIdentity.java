package com.vtb.nessus.core;

import lombok.Value;

import java.util.Map;

import static com.vtb.nessus.util.FieldCoercion.firstNonEmpty;

/**
 * Отображаемое имя, hostname и IP хоста, вычисленные из его свойств
 */
@Value
public class HostIdentity {

    public static final String UNKNOWN_HOST = "Unknown Host";

    String displayName;
    String hostname;
    String ipAddress;

    /**
     * host-fqdn → host-name → атрибут name у ReportHost → "Unknown Host"
     */
    public static HostIdentity resolve(String rawName, Map<String, String> properties) {
        String hostName = firstNonEmpty(rawName, UNKNOWN_HOST);
        String displayName = firstNonEmpty(
            properties.get(HostPropertyExtractor.HOST_FQDN),
            properties.get(HostPropertyExtractor.HOST_NAME),
            hostName);
        return new HostIdentity(
            displayName,
            properties.get(HostPropertyExtractor.HOST_NAME),
            properties.get(HostPropertyExtractor.HOST_IP));
    }
}
