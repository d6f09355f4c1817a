package dev.sitepack.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.sitepack.synthesis.Claim;
import dev.sitepack.synthesis.EvidenceRecord;
import dev.sitepack.synthesis.IntelligencePack;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Checks a synthesized pack and reports problems as warnings. Never throws for a bad pack and
 * never removes anything from it.
 */
@Service
public class SchemaValidator {

  private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

  private static final List<String> REQUIRED_SECTIONS =
      List.of("site_metadata", "claims_by_dimension", "evidence_index");

  private final ObjectMapper objectMapper;

  public SchemaValidator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * @param knownPageUrls URLs of pages in the run's inventory
   */
  public ValidationReport validate(IntelligencePack pack, Set<String> knownPageUrls) {
    List<String> warnings = new ArrayList<>();

    JsonNode tree = objectMapper.valueToTree(pack);
    for (String section : REQUIRED_SECTIONS) {
      if (!tree.hasNonNull(section)) {
        warnings.add("Missing required section: " + section);
      }
    }
    if (!tree.path("site_metadata").hasNonNull("domain")) {
      warnings.add("Missing required section: site_metadata.domain");
    }

    Map<String, EvidenceRecord> index =
        pack.evidenceIndex() == null ? Map.of() : pack.evidenceIndex();
    if (pack.claimsByDimension() != null) {
      for (List<Claim> claims : pack.claimsByDimension().values()) {
        for (Claim claim : claims) {
          checkClaim(claim, index, warnings);
        }
      }
    }

    for (Map.Entry<String, EvidenceRecord> evidence : index.entrySet()) {
      if (!knownPageUrls.contains(evidence.getValue().sourceUrl())) {
        warnings.add(
            "Evidence "
                + evidence.getKey()
                + " comes from "
                + evidence.getValue().sourceUrl()
                + ", which is not a known page");
      }
    }

    if (warnings.isEmpty()) {
      log.info("Intelligence pack validated without warnings");
    } else {
      log.warn("Intelligence pack validated with {} warnings", warnings.size());
    }
    return ValidationReport.of(warnings);
  }

  private static void checkClaim(
      Claim claim, Map<String, EvidenceRecord> index, List<String> warnings) {
    for (String ref : claim.evidenceRefs()) {
      if (!index.containsKey(ref)) {
        warnings.add(
            "Claim " + claim.id() + " (" + claim.dimension() + ") cites unresolved evidence " + ref);
      }
    }
    if (claim.broken()) {
      warnings.add(
          "Claim " + claim.id() + " (" + claim.dimension() + ") has no resolvable evidence");
    }
  }
}
