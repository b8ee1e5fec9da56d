package com.recordplatform.schemashift.dto.resolver;

import com.recordplatform.schemashift.model.FieldType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Loose field reference: any combination of name, key, aliases and expected type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldQuery {
    private String name;
    private String key;
    @Builder.Default
    private List<String> aliases = new ArrayList<>();
    private FieldType type;

    /**
     * A bare string reference is treated as both a label and a key.
     */
    public static FieldQuery of(String reference) {
        return FieldQuery.builder()
                .name(reference)
                .key(reference)
                .build();
    }
}
