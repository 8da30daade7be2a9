package com.openforge.rxmate.pharmacy;

import com.openforge.rxmate.domain.InventoryItem;
import com.openforge.rxmate.domain.Medication;
import com.openforge.rxmate.domain.PharmacyUser;
import com.openforge.rxmate.domain.Prescription;
import com.openforge.rxmate.domain.Store;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * A small catalog shared by the pharmacy tool tests. "Today" is 2025-03-01.
 *
 *   MED001 Tylenol (Acetaminophen)       ST001:40  ST002:0  ST003:12  ST999:3 (unknown store)
 *   MED002 Advil (Ibuprofen)             ST002:5
 *   MED003 Amoxil (Amoxicillin), Rx      ST001:0
 *   MED004 Coldrex, contains acetaminophen, no stock
 */
final class PharmacyFixtures {

    static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:15:30Z"), ZoneOffset.UTC);
    static final LocalDate TODAY = LocalDate.of(2025, 3, 1);
    static final LocalDateTime STOCK_UPDATED = LocalDateTime.of(2025, 2, 28, 9, 0);

    private PharmacyFixtures() {}

    static void seed(TestEntityManager em) {
        em.persist(medication("MED001", "Tylenol", "Acetaminophen", "Acetaminophen", "Tablet", "500mg", false));
        em.persist(medication("MED002", "Advil", "Ibuprofen", "Ibuprofen", "Tablet", "200mg", false));
        em.persist(medication("MED003", "Amoxil", "Amoxicillin", "Amoxicillin", "Capsule", "500mg", true));
        em.persist(medication("MED004", "Coldrex", "Paracetamol combination",
                "Acetaminophen, Pseudoephedrine", "Tablet", "500mg/30mg", false));

        em.persist(new Store("ST001", "Tel Aviv", "Wonderful Dizengoff"));
        em.persist(new Store("ST002", "Haifa", "Wonderful Carmel"));
        em.persist(new Store("ST003", "Tel Aviv", "Wonderful Azrieli"));

        em.persist(stock("ST001", "MED001", 40));
        em.persist(stock("ST002", "MED001", 0));
        em.persist(stock("ST003", "MED001", 12));
        em.persist(stock("ST999", "MED001", 3));
        em.persist(stock("ST002", "MED002", 5));
        em.persist(stock("ST001", "MED003", 0));

        em.persist(new PharmacyUser("U001", "Dana Levi", "050-1111111", "dana@example.com", "he"));
        em.persist(new PharmacyUser("U002", "Avi Cohen", "052-2222222", "avi.cohen@example.com", "en"));
        em.persist(new PharmacyUser("U003", "Noa Levin", "054-3333333", "noa@example.org", "he"));

        em.persist(prescription("RX001", "U001", "MED003", 2, LocalDate.of(2025, 9, 1)));
        em.persist(prescription("RX002", "U001", "MED001", 0, LocalDate.of(2025, 12, 31)));
        em.persist(prescription("RX003", "U002", "MED003", 1, LocalDate.of(2025, 2, 1)));
        em.persist(prescription("RX004", "U002", "MED002", 3, LocalDate.of(2025, 3, 10)));
        em.persist(prescription("RX005", "U001", "MED002", 0, LocalDate.of(2025, 1, 1)));

        em.flush();
        em.clear();
    }

    static Medication medication(String id, String brand, String generic, String ingredients,
                                 String form, String strength, boolean rx) {
        return Medication.builder()
                .medId(id)
                .brandName(brand)
                .genericName(generic)
                .activeIngredients(ingredients)
                .form(form)
                .strength(strength)
                .rxRequired(rx)
                .standardDirections("As directed")
                .warnings("Keep out of reach of children")
                .contraindications("Known allergy")
                .build();
    }

    private static InventoryItem stock(String storeId, String medId, int quantity) {
        return InventoryItem.builder()
                .storeId(storeId)
                .medId(medId)
                .quantity(quantity)
                .lastUpdated(STOCK_UPDATED)
                .build();
    }

    private static Prescription prescription(String id, String userId, String medId, int refills, LocalDate expires) {
        return Prescription.builder()
                .prescriptionId(id)
                .userId(userId)
                .medId(medId)
                .directions("Take as prescribed")
                .refillsRemaining(refills)
                .expiresAt(expires)
                .build();
    }
}
