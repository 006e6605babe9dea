package org.ferry.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ExtensionDescriptor implements Descriptor {
    String name;
    String schema;
    String version;

    @Override
    public String key() {
        return name;
    }
}
