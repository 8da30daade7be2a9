package com.openforge.rxmate.pharmacy;

import com.openforge.rxmate.domain.InventoryItem;
import com.openforge.rxmate.domain.Medication;
import com.openforge.rxmate.domain.Store;
import com.openforge.rxmate.repository.InventoryRepository;
import com.openforge.rxmate.repository.MedicationRepository;
import com.openforge.rxmate.repository.StoreRepository;
import com.openforge.rxmate.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import static com.openforge.rxmate.pharmacy.PharmacySpecifications.*;

/** Store and stock tools. */
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InventoryTools {

    private final InventoryRepository  inventoryRepository;
    private final MedicationRepository medicationRepository;
    private final StoreRepository      storeRepository;
    private final MedicationTools      medicationTools;

    // ── check_stock_availability ─────────────────────────────────────────────

    public Map<String, Object> checkStockAvailability(ToolArguments args) {
        String medId   = args.string("med_id");
        String storeId = args.string("store_id");

        Optional<InventoryItem> item = inventoryRepository.findByMedIdAndStoreId(medId, storeId);
        Map<String, Object> out = new LinkedHashMap<>();
        if (item.isEmpty()) {
            out.put("error", "NOT_FOUND");
            out.put("med_id", medId);
            out.put("store_id", storeId);
            return out;
        }
        out.put("med_id", medId);
        out.put("store_id", storeId);
        out.put("quantity", item.get().getQuantity());
        out.put("status", item.get().stockStatus());
        out.put("last_updated", iso(item.get().getLastUpdated()));
        return out;
    }

    // ── query_medications_with_stock ─────────────────────────────────────────

    public Map<String, Object> queryMedicationsWithStock(ToolArguments args) {
        String term = args.string("search_term");
        Specification<Medication> filter = allOf(
                anyOf(containsIgnoreCase("brandName", term),
                      containsIgnoreCase("genericName", term),
                      containsIgnoreCase("activeIngredients", term)),
                containsIgnoreCase("activeIngredients", args.string("active_ingredient")),
                containsIgnoreCase("form", args.string("form")),
                equalTo("rxRequired", args.bool("rx_required")));
        List<String> storeIds    = args.stringList("store_ids");
        boolean      inStockOnly = args.bool("in_stock_only", false);
        int          limit       = MedicationTools.positive(args.integer("limit", MedicationTools.DEFAULT_LIMIT));

        List<Medication> meds = medicationRepository.findAll(filter, Sort.by("brandName"));
        Map<String, List<Map<String, Object>>> stockByMed = new LinkedHashMap<>();
        meds.forEach(m -> stockByMed.put(m.getMedId(), new ArrayList<>()));

        if (!meds.isEmpty()) {
            Predicate<InventoryItem> keep = stockFilter(storeIds, inStockOnly);
            for (InventoryItem item : inventoryRepository.findByMedIdInOrderByStoreIdAsc(stockByMed.keySet())) {
                if (!keep.test(item)) continue;
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("store_id", item.getStoreId());
                entry.put("quantity", item.getQuantity());
                entry.put("status", item.stockStatus());
                stockByMed.get(item.getMedId()).add(entry);
            }
        }

        List<Map<String, Object>> medications = new ArrayList<>();
        for (Medication med : meds) {
            List<Map<String, Object>> stock = stockByMed.get(med.getMedId());
            if (inStockOnly && stock.isEmpty()) continue;
            Map<String, Object> row = MedicationTools.summary(med);
            row.put("stock", stock);
            medications.add(row);
            if (medications.size() >= limit) break;
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("count", medications.size());
        out.put("medications", medications);
        return out;
    }

    // ── query_stock_multiple_stores ──────────────────────────────────────────

    public Map<String, Object> queryStockMultipleStores(ToolArguments args) {
        String medId   = args.string("med_id");
        String medName = args.string("med_name");

        if (medId == null && medName != null) {
            Optional<Medication> resolved = medicationTools.resolveUnique(medName);
            if (resolved.isEmpty()) {
                return medicationNotFound(medName);
            }
            medId = resolved.get().getMedId();
        }
        if (medId == null) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("error", "MISSING_PARAMETER");
            out.put("message", "Either med_id or med_name must be provided");
            return out;
        }

        Predicate<InventoryItem> keep = stockFilter(args.stringList("store_ids"), args.bool("in_stock_only", false));
        List<Map<String, Object>> stock = new ArrayList<>();
        for (InventoryItem item : inventoryRepository.findByMedIdWithStore(medId)) {
            if (!keep.test(item)) continue;
            Store store = item.getStore();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("store_id", item.getStoreId());
            row.put("store_name", store == null ? null : store.getName());
            row.put("city", store == null ? null : store.getCity());
            row.put("quantity", item.getQuantity());
            row.put("status", item.stockStatus());
            row.put("last_updated", iso(item.getLastUpdated()));
            stock.add(row);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("med_id", medId);
        out.put("med_name", medicationRepository.findById(medId).map(Medication::displayName).orElse(null));
        out.put("count", stock.size());
        out.put("stock", stock);
        return out;
    }

    // ── list_stores ──────────────────────────────────────────────────────────

    public Map<String, Object> listStores(ToolArguments args) {
        String city = args.string("city");
        List<Store> stores = city == null
                ? storeRepository.findAllByOrderByCityAscNameAsc()
                : storeRepository.findByCityContainingIgnoreCaseOrderByNameAsc(city);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("count", stores.size());
        out.put("stores", stores.stream().map(s -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("store_id", s.getStoreId());
            row.put("name", s.getName());
            row.put("city", s.getCity());
            return row;
        }).toList());
        return out;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static Map<String, Object> medicationNotFound(String medName) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", "MEDICATION_NOT_FOUND");
        out.put("med_name", medName);
        out.put("message", "Medication not found in catalog");
        return out;
    }

    private static Predicate<InventoryItem> stockFilter(List<String> storeIds, boolean inStockOnly) {
        return item -> (storeIds.isEmpty() || storeIds.contains(item.getStoreId()))
                && (!inStockOnly || item.inStock());
    }

    private static String iso(LocalDateTime time) {
        return time == null ? null : time.toString();
    }
}
