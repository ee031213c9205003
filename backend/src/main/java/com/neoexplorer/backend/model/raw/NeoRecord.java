package com.neoexplorer.backend.model.raw;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the NEO CSV file. Values stay textual; conversion happens in the extractor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NeoRecord {

    @JsonAlias("pdes")
    private String designation;

    private String name;

    private String diameter;

    // "Y" or "N"
    @JsonAlias("pha")
    private String hazardous;
}
