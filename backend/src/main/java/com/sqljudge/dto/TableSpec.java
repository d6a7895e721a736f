package com.sqljudge.dto;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TableSpec {

    @NotBlank(message = "Table name is required")
    private String name;

    @Valid
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<ColumnSpec> columns = new ArrayList<>();

    public static TableSpec of(String name, ColumnSpec... columns) {
        return new TableSpec(name, new ArrayList<>(Arrays.asList(columns)));
    }
}
