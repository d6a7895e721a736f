package com.sqljudge.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * One entry of a table declaration. An entry without a type is a table-level
 * constraint clause whose name holds the clause text, e.g. {@code PRIMARY KEY (a, b)}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ColumnSpec {

    @NotBlank(message = "Column name is required")
    private String name;

    private String type;

    private String constraints;

    public static ColumnSpec of(String name, String type) {
        return new ColumnSpec(name, type, null);
    }

    public static ColumnSpec of(String name, String type, String constraints) {
        return new ColumnSpec(name, type, constraints);
    }

    public static ColumnSpec tableConstraint(String clause) {
        return new ColumnSpec(clause, null, null);
    }

    @JsonIgnore
    public boolean isTableConstraint() {
        return type == null || type.isBlank();
    }
}
