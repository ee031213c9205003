package com.neoexplorer.backend.model.raw;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CadPayload {

    private List<String> fields = List.of();

    private List<List<String>> data = List.of();
}
