package dev.sitepack.synthesis;

import dev.sitepack.extraction.ExtractedField;
import dev.sitepack.extraction.ExtractionPrompts;
import dev.sitepack.extraction.ExtractionUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Merges extraction units into an {@link IntelligencePack} draft.
 *
 * <p>Evidence is re-keyed to {@code EV_0001, EV_0002, ...} walking units by rank and each unit's
 * local IDs in sorted order, so the IDs depend only on the inputs and never on which extraction
 * finished first. Every unit's value for a dimension becomes its own claim; nothing is merged or
 * overwritten.
 */
@Service
public class Synthesizer {

  private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

  private static final Comparator<ExtractionUnit> RANK_ORDER =
      Comparator.comparingInt(ExtractionUnit::rank).thenComparing(ExtractionUnit::sourceUrl);

  public IntelligencePack synthesize(SiteMetadata metadata, List<ExtractionUnit> units) {
    List<ExtractionUnit> ordered = units.stream().sorted(RANK_ORDER).toList();

    Map<String, EvidenceRecord> evidenceIndex = new LinkedHashMap<>();
    List<Map<String, String>> globalIdsByUnit = new ArrayList<>(ordered.size());
    int evidenceCounter = 0;
    for (ExtractionUnit unit : ordered) {
      Map<String, String> localToGlobal = new HashMap<>();
      for (Map.Entry<String, String> local : unit.evidence().entrySet()) {
        String globalId = String.format("EV_%04d", ++evidenceCounter);
        localToGlobal.put(local.getKey(), globalId);
        evidenceIndex.put(
            globalId,
            new EvidenceRecord(
                unit.sourceUrl(), local.getValue(), unit.pageTitle(), unit.extractedAt()));
      }
      globalIdsByUnit.add(localToGlobal);
    }

    Map<String, List<Claim>> claimsByDimension = new LinkedHashMap<>();
    int claimCounter = 0;
    int brokenCount = 0;
    for (String dimension : dimensionOrder(ordered)) {
      List<Claim> claims = new ArrayList<>();
      for (int i = 0; i < ordered.size(); i++) {
        ExtractionUnit unit = ordered.get(i);
        ExtractedField field = unit.entityFields().get(dimension);
        if (field == null) {
          continue;
        }
        Map<String, String> localToGlobal = globalIdsByUnit.get(i);
        List<String> refs = new ArrayList<>();
        boolean anyResolved = false;
        for (String localId : field.evidence()) {
          String globalId = localToGlobal.get(localId);
          if (globalId != null) {
            refs.add(globalId);
            anyResolved = true;
          } else {
            refs.add(Claim.UNRESOLVED_PREFIX + localId);
          }
        }
        if (!anyResolved) {
          brokenCount++;
        }
        claims.add(
            new Claim(
                String.format("CL_%04d", ++claimCounter),
                dimension,
                field.value(),
                refs,
                unit.sourceUrl(),
                !anyResolved));
      }
      claimsByDimension.put(dimension, claims);
    }

    List<String> gaps = new ArrayList<>();
    for (String dimension : ExtractionPrompts.KNOWN_DIMENSIONS) {
      if (claimsByDimension.get(dimension).isEmpty()) {
        gaps.add("No findings for " + dimension);
      }
    }
    for (ExtractionUnit unit : ordered) {
      if (unit.failed()) {
        gaps.add("Extraction failed for " + unit.sourceUrl() + ": " + unit.failureNote());
      }
    }

    log.info(
        "Synthesized {} claims ({} broken) across {} dimensions with {} evidence entries",
        claimCounter,
        brokenCount,
        claimsByDimension.size(),
        evidenceIndex.size());
    return new IntelligencePack(metadata, claimsByDimension, evidenceIndex, gaps, List.of());
  }

  /** Known dimensions first, in report order, then any others alphabetically. */
  private static List<String> dimensionOrder(List<ExtractionUnit> units) {
    List<String> order = new ArrayList<>(ExtractionPrompts.KNOWN_DIMENSIONS);
    Set<String> extra = new TreeSet<>();
    for (ExtractionUnit unit : units) {
      extra.addAll(unit.entityFields().keySet());
    }
    extra.removeAll(ExtractionPrompts.KNOWN_DIMENSIONS);
    order.addAll(extra);
    return order;
  }
}
