package com.openforge.rxmate.pharmacy;

import com.openforge.rxmate.domain.Medication;
import com.openforge.rxmate.repository.MedicationRepository;
import com.openforge.rxmate.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.openforge.rxmate.pharmacy.PharmacySpecifications.*;

/**
 * Catalog tools: exact and fuzzy lookup, browsing and multi-filter search.
 *
 * Not transactional on purpose: the fuzzy lookup may fail on databases
 * without pg_trgm, and that failure must not poison a surrounding transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MedicationTools {

    static final String CATALOG_SOURCE = "Synthetic internal pharmacy catalog";
    static final int    DEFAULT_LIMIT  = 20;

    private static final Sort BY_BRAND = Sort.by("brandName");

    private final MedicationRepository medicationRepository;

    // ── get_medication_by_name ───────────────────────────────────────────────

    public Map<String, Object> getMedicationByName(ToolArguments args) {
        String name = args.string("name");
        if (name == null) {
            return Map.of("found", false, "candidates", List.of(), "input_name", "");
        }

        List<Medication> hits = medicationRepository.searchByNameFragment(name);

        if (hits.isEmpty()) {
            List<Map<String, Object>> fuzzy = fuzzyCandidates(name);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("found", false);
            if (!fuzzy.isEmpty()) {
                out.put("ambiguous", true);
                out.put("fuzzy", true);
            }
            out.put("input_name", name);
            out.put("candidates", fuzzy);
            return out;
        }

        if (hits.size() > 1) {
            List<Map<String, Object>> candidates = hits.stream()
                    .limit(5)
                    .map(MedicationTools::candidate)
                    .toList();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("found", false);
            out.put("ambiguous", true);
            out.put("input_name", name);
            out.put("candidates", candidates);
            return out;
        }

        Medication med = hits.get(0);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("med_id", med.getMedId());
        detail.put("brand_name", med.getBrandName());
        detail.put("generic_name", med.getGenericName());
        detail.put("active_ingredients", med.activeIngredientList());
        detail.put("form", med.getForm());
        detail.put("strength", med.getStrength());
        detail.put("rx_required", med.isRxRequired());
        detail.put("standard_directions", med.getStandardDirections() == null ? "" : med.getStandardDirections());
        detail.put("warnings", asList(med.getWarnings()));
        detail.put("contraindications", asList(med.getContraindications()));
        detail.put("source", CATALOG_SOURCE);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("found", true);
        out.put("med", detail);
        return out;
    }

    // ── list_medications ─────────────────────────────────────────────────────

    public Map<String, Object> listMedications(ToolArguments args) {
        String term  = args.string("search_term");
        int    limit = positive(args.integer("limit", DEFAULT_LIMIT));

        List<Medication> rows = term == null
                ? medicationRepository.findAll(PageRequest.of(0, limit, BY_BRAND)).getContent()
                : medicationRepository.searchRanked(term, PageRequest.of(0, limit));
        return medicationList(rows);
    }

    // ── query_medications_flexible ───────────────────────────────────────────

    public Map<String, Object> queryMedicationsFlexible(ToolArguments args) {
        Specification<Medication> filter = allOf(
                containsIgnoreCase("brandName", args.string("brand_name")),
                containsIgnoreCase("genericName", args.string("generic_name")),
                containsIgnoreCase("activeIngredients", args.string("active_ingredient")),
                containsIgnoreCase("form", args.string("form")),
                containsIgnoreCase("strength", args.string("strength")),
                equalTo("rxRequired", args.bool("rx_required")));
        int limit = positive(args.integer("limit", DEFAULT_LIMIT));

        return medicationList(medicationRepository.findAll(filter, PageRequest.of(0, limit, BY_BRAND)).getContent());
    }

    // ── Shared with the stock and prescription tools ─────────────────────────

    /** The single catalog entry a name refers to, if it is unambiguous. */
    public Optional<Medication> resolveUnique(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        List<Medication> hits = medicationRepository.searchByNameFragment(name.trim());
        return hits.size() == 1 ? Optional.of(hits.get(0)) : Optional.empty();
    }

    static Map<String, Object> summary(Medication med) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("med_id", med.getMedId());
        row.put("brand_name", med.getBrandName());
        row.put("generic_name", med.getGenericName());
        row.put("active_ingredients", med.getActiveIngredients());
        row.put("form", med.getForm());
        row.put("strength", med.getStrength());
        row.put("rx_required", med.isRxRequired());
        return row;
    }

    static int positive(int limit) {
        return limit > 0 ? limit : DEFAULT_LIMIT;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private List<Map<String, Object>> fuzzyCandidates(String name) {
        List<Object[]> rows;
        try {
            rows = medicationRepository.findSimilarByName(name);
        } catch (RuntimeException e) {
            log.warn("[MedicationTools] Fuzzy lookup unavailable for name='{}': {}", name, e.getMessage());
            return List.of();
        }
        List<Map<String, Object>> candidates = new ArrayList<>();
        for (Object[] row : rows) {
            Map<String, Object> candidate = new LinkedHashMap<>();
            candidate.put("med_id", row[0]);
            candidate.put("brand", row[1]);
            candidate.put("generic", row[2]);
            candidate.put("score", row[3] instanceof Number score ? score.doubleValue() : 0.0);
            candidates.add(candidate);
        }
        return candidates;
    }

    private static Map<String, Object> candidate(Medication med) {
        Map<String, Object> candidate = new LinkedHashMap<>();
        candidate.put("med_id", med.getMedId());
        candidate.put("brand", med.getBrandName());
        candidate.put("generic", med.getGenericName());
        return candidate;
    }

    private static Map<String, Object> medicationList(List<Medication> rows) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("count", rows.size());
        out.put("medications", rows.stream().map(MedicationTools::summary).toList());
        return out;
    }


    private static List<String> asList(String text) {
        return text == null || text.isBlank() ? List.of() : List.of(text);
    }
}
