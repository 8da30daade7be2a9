package com.openforge.rxmate.pharmacy;

import com.openforge.rxmate.tool.ToolArguments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({InventoryTools.class, MedicationTools.class})
class InventoryToolsTest {

    @Autowired
    private TestEntityManager em;

    @Autowired
    private InventoryTools tools;

    @BeforeEach
    void seed() {
        PharmacyFixtures.seed(em);
    }

    // ===== check_stock_availability =====

    @Test
    void shouldReportStockOfOneStore() {
        Map<String, Object> out = tools.checkStockAvailability(args(Map.of("med_id", "MED001", "store_id", "ST001")));

        assertThat(out)
                .containsEntry("quantity", 40)
                .containsEntry("status", "in_stock")
                .containsEntry("last_updated", "2025-02-28T09:00");
    }

    @Test
    void shouldReportZeroQuantityAsOutOfStock() {
        Map<String, Object> out = tools.checkStockAvailability(args(Map.of("med_id", "MED001", "store_id", "ST002")));

        assertThat(out).containsEntry("quantity", 0).containsEntry("status", "out_of_stock");
    }

    @Test
    void shouldReportMissingInventoryRow() {
        Map<String, Object> out = tools.checkStockAvailability(args(Map.of("med_id", "MED002", "store_id", "ST001")));

        assertThat(out)
                .containsEntry("error", "NOT_FOUND")
                .containsEntry("med_id", "MED002")
                .containsEntry("store_id", "ST001");
    }

    // ===== query_stock_multiple_stores =====

    @Test
    void shouldListStockAcrossStoresIncludingUnknownStore() {
        Map<String, Object> out = tools.queryStockMultipleStores(args(Map.of("med_id", "MED001")));

        assertThat(out)
                .containsEntry("med_id", "MED001")
                .containsEntry("med_name", "Tylenol (Acetaminophen)")
                .containsEntry("count", 4);
        assertThat(stock(out)).extracting(r -> r.get("store_id"))
                .containsExactlyInAnyOrder("ST001", "ST002", "ST003", "ST999");
        assertThat(stock(out)).filteredOn(r -> "ST999".equals(r.get("store_id")))
                .singleElement()
                .satisfies(r -> assertThat(r).containsEntry("store_name", null).containsEntry("city", null));
    }

    @Test
    void shouldOrderKnownStoresByCityThenName() {
        Map<String, Object> out = tools.queryStockMultipleStores(args(Map.of(
                "med_id", "MED001", "store_ids", List.of("ST001", "ST002", "ST003"))));

        assertThat(stock(out)).extracting(r -> r.get("store_id")).containsExactly("ST002", "ST003", "ST001");
        assertThat(stock(out).get(0))
                .containsEntry("store_name", "Wonderful Carmel")
                .containsEntry("city", "Haifa");
    }

    @Test
    void shouldDropEmptyShelvesWhenInStockOnly() {
        Map<String, Object> out = tools.queryStockMultipleStores(args(Map.of(
                "med_id", "MED001", "in_stock_only", true)));

        assertThat(stock(out)).extracting(r -> r.get("store_id"))
                .containsExactlyInAnyOrder("ST001", "ST003", "ST999");
    }

    @Test
    void shouldResolveUniqueMedicationName() {
        Map<String, Object> out = tools.queryStockMultipleStores(args(Map.of("med_name", "tylenol")));

        assertThat(out).containsEntry("med_id", "MED001").containsEntry("count", 4);
    }

    @Test
    void shouldTreatAmbiguousNameAsNotFound() {
        // matches Tylenol's generic name and Coldrex's ingredients
        Map<String, Object> out = tools.queryStockMultipleStores(args(Map.of("med_name", "acetaminophen")));

        assertThat(out).containsEntry("error", "MEDICATION_NOT_FOUND").containsEntry("med_name", "acetaminophen");
    }

    @Test
    void shouldRequireMedicationIdOrName() {
        Map<String, Object> out = tools.queryStockMultipleStores(args(Map.of("store_ids", List.of("ST001"))));

        assertThat(out).containsEntry("error", "MISSING_PARAMETER");
    }

    // ===== query_medications_with_stock =====

    @Test
    void shouldAttachStockToEveryMatchingMedication() {
        Map<String, Object> out = tools.queryMedicationsWithStock(args(Map.of("search_term", "acetaminophen")));

        List<Map<String, Object>> meds = meds(out);
        assertThat(meds).extracting(m -> m.get("med_id")).containsExactly("MED004", "MED001");
        assertThat(stock(meds.get(0))).isEmpty();
        assertThat(stock(meds.get(1))).extracting(r -> r.get("store_id"))
                .containsExactly("ST001", "ST002", "ST003", "ST999");
    }

    @Test
    void shouldRestrictStockToRequestedStoresInStock() {
        Map<String, Object> out = tools.queryMedicationsWithStock(args(Map.of(
                "search_term", "acetaminophen", "store_ids", List.of("ST001", "ST002"), "in_stock_only", true)));

        List<Map<String, Object>> meds = meds(out);
        assertThat(out).containsEntry("count", 1);
        assertThat(meds.get(0)).containsEntry("med_id", "MED001");
        assertThat(stock(meds.get(0))).singleElement()
                .satisfies(r -> assertThat(r).containsEntry("store_id", "ST001").containsEntry("quantity", 40));
    }

    @Test
    void shouldApplyInStockOnlyWithoutStoreFilter() {
        Map<String, Object> out = tools.queryMedicationsWithStock(args(Map.of("rx_required", true, "in_stock_only", true)));

        assertThat(out).containsEntry("count", 0);
    }

    @Test
    void shouldLimitMedications() {
        Map<String, Object> out = tools.queryMedicationsWithStock(args(Map.of("form", "tablet", "limit", 2)));

        assertThat(meds(out)).extracting(m -> m.get("brand_name")).containsExactly("Advil", "Coldrex");
    }

    // ===== list_stores =====

    @Test
    void shouldListStoresByCityThenName() {
        Map<String, Object> out = tools.listStores(ToolArguments.empty());

        assertThat(out).containsEntry("count", 3);
        assertThat(stores(out)).extracting(s -> s.get("store_id")).containsExactly("ST002", "ST003", "ST001");
    }

    @Test
    void shouldFilterStoresByCityFragment() {
        Map<String, Object> out = tools.listStores(args(Map.of("city", "tel")));

        assertThat(stores(out)).extracting(s -> s.get("name"))
                .containsExactly("Wonderful Azrieli", "Wonderful Dizengoff");
    }

    private static ToolArguments args(Map<String, ?> values) {
        return ToolArguments.of(values);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> stock(Map<String, Object> out) {
        return (List<Map<String, Object>>) out.get("stock");
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> meds(Map<String, Object> out) {
        return (List<Map<String, Object>>) out.get("medications");
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> stores(Map<String, Object> out) {
        return (List<Map<String, Object>>) out.get("stores");
    }
}
