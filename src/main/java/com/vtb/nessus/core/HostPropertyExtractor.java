package com.vtb.nessus.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.vtb.nessus.util.FieldCoercion.TEXT_KEY;
import static com.vtb.nessus.util.FieldCoercion.ensureSequence;
import static com.vtb.nessus.util.FieldCoercion.field;
import static com.vtb.nessus.util.FieldCoercion.firstNonEmpty;

/**
 * Извлекает таблицу свойств хоста из HostProperties/tag
 */
public class HostPropertyExtractor {

    public static final String HOST_FQDN = "host-fqdn";
    public static final String HOST_NAME = "host-name";
    public static final String HOST_IP = "host-ip";

    /**
     * Тег без name пропускается. Значение берется из текста тега, затем из
     * атрибута value; присутствующий, но пустой тег хранится как "".
     */
    public Map<String, String> extract(JsonNode host) {
        Map<String, String> properties = new LinkedHashMap<>();
        if (host == null) {
            return properties;
        }
        JsonNode tags = host.path("HostProperties").path("tag");
        for (JsonNode tag : ensureSequence(tags)) {
            String name = field(tag, "name");
            if (name == null || name.isEmpty()) {
                continue;
            }
            String value = firstNonEmpty(field(tag, TEXT_KEY), field(tag, "value"));
            properties.put(name, value != null ? value : "");
        }
        return properties;
    }

    public HostIdentity identify(JsonNode host) {
        return HostIdentity.resolve(field(host, "name"), extract(host));
    }
}
