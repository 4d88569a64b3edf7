package org.bacteria.service.transform;

import org.bacteria.models.record.FieldMapping;
import org.bacteria.models.record.RawRecord;

import java.util.List;

import static org.bacteria.models.record.FieldMapping.list;
import static org.bacteria.models.record.FieldMapping.value;

/**
 * BacDive detail payload to normalized record. Row order is the key order of the output JSON.
 */
public final class RecordFieldMappings {

    public static final String TAXONOMY_GROUP = "Name and taxonomic classification";
    public static final String CULTURE_GROUP = "Culture and growth conditions";
    public static final String PHYSIOLOGY_GROUP = "Physiology and metabolism";
    public static final String SAFETY_GROUP = "Safety information";
    public static final String SEQUENCE_GROUP = "Sequence information";
    public static final String LINKS_GROUP = "External links";

    public static final List<String> IDENTIFIER_PATH = List.of(RawRecord.GENERAL_GROUP, RawRecord.IDENTIFIER_KEY);

    public static final List<FieldMapping> BACDIVE = List.of(
            value("general.description", RawRecord.GENERAL_GROUP, "description"),
            value("general.DSM_Number", RawRecord.GENERAL_GROUP, "DSM-Number"),
            value("general.NCBI_tax_id", RawRecord.GENERAL_GROUP, "NCBI tax id", "NCBI tax id"),
            list("general.keywords", RawRecord.GENERAL_GROUP, "keywords"),

            value("taxonomy.genus", TAXONOMY_GROUP, "genus"),
            value("taxonomy.species", TAXONOMY_GROUP, "species"),
            value("taxonomy.strain_designation", TAXONOMY_GROUP, "strain designation"),
            value("taxonomy.type_strain", TAXONOMY_GROUP, "type strain"),
            value("taxonomy.full_scientific_name", TAXONOMY_GROUP, "full scientific name"),
            value("LPSN", TAXONOMY_GROUP, "LPSN"),

            value("culture_conditions.medium", CULTURE_GROUP, "culture medium"),
            value("culture_conditions.temperatures", CULTURE_GROUP, "culture temp"),

            value("physiology_and_metabolism.compound_production", PHYSIOLOGY_GROUP, "compound production"),
            value("physiology_and_metabolism.enzymes", PHYSIOLOGY_GROUP, "enzymes"),

            value("biosafety.level", SAFETY_GROUP, "risk assessment", "biosafety level"),
            value("biosafety.comment", SAFETY_GROUP, "risk assessment", "biosafety level comment"),

            value("sequence_information", SEQUENCE_GROUP, "GC content"),

            value("external_links.culture_collections", LINKS_GROUP, "culture collection no."),
            value("external_links.literature", LINKS_GROUP, "literature")
    );

    private RecordFieldMappings() {
    }
}
