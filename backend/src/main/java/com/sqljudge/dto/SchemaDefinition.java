package com.sqljudge.dto;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import jakarta.validation.Valid;
import lombok.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SchemaDefinition {

    @Valid
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    @Builder.Default
    private List<TableSpec> tables = new ArrayList<>();

    public static SchemaDefinition of(TableSpec... tables) {
        return new SchemaDefinition(new ArrayList<>(Arrays.asList(tables)));
    }

    public Optional<TableSpec> findTable(String name) {
        return tables.stream()
                .filter(t -> t.getName().equalsIgnoreCase(name))
                .findFirst();
    }
}
