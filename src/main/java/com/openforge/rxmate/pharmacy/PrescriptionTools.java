package com.openforge.rxmate.pharmacy;

import com.openforge.rxmate.domain.Medication;
import com.openforge.rxmate.domain.Prescription;
import com.openforge.rxmate.domain.RefillRequest;
import com.openforge.rxmate.repository.PrescriptionRepository;
import com.openforge.rxmate.repository.RefillRequestRepository;
import com.openforge.rxmate.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.openforge.rxmate.pharmacy.PharmacySpecifications.*;

/** Prescription listing, flexible search and the refill workflow. */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PrescriptionTools {

    static final int DEFAULT_LIMIT = 50;
    static final int REFILL_ETA_HOURS = 4;

    private static final DateTimeFormatter REFILL_STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");

    private final PrescriptionRepository  prescriptionRepository;
    private final RefillRequestRepository refillRequestRepository;
    private final MedicationTools         medicationTools;
    private final Clock                   clock;

    // ── list_user_prescriptions ──────────────────────────────────────────────

    public Map<String, Object> listUserPrescriptions(ToolArguments args) {
        String userId = args.string("user_id");
        List<Map<String, Object>> rows = prescriptionRepository.findByUserIdWithMedication(userId).stream()
                .map(p -> {
                    Map<String, Object> row = baseRow(p);
                    row.put("rx_required", p.getMedication().isRxRequired());
                    return row;
                })
                .toList();

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("user_id", userId);
        out.put("prescriptions", rows);
        return out;
    }

    // ── request_prescription_refill ──────────────────────────────────────────

    /**
     * Checks run in a fixed order: NOT_FOUND, UNAUTHORIZED, NO_REFILLS, EXPIRED.
     * On acceptance the refill row and the decremented refill count commit together.
     */
    @Transactional
    public Map<String, Object> requestRefill(ToolArguments args) {
        String userId         = args.string("user_id");
        String prescriptionId = args.string("prescription_id");
        LocalDateTime now     = LocalDateTime.now(clock);

        Optional<Prescription> found = prescriptionRepository.findById(prescriptionId);
        if (found.isEmpty())                                return rejected("NOT_FOUND");
        Prescription rx = found.get();
        if (!rx.getUserId().equals(userId))                 return rejected("UNAUTHORIZED");
        if (rx.getRefillsRemaining() <= 0)                  return rejected("NO_REFILLS");
        if (rx.isExpired(now.toLocalDate()))                return rejected("EXPIRED");

        String refillRequestId = "RR-" + REFILL_STAMP.format(now) + "-" + prescriptionId;
        refillRequestRepository.save(RefillRequest.builder()
                .refillRequestId(refillRequestId)
                .prescriptionId(prescriptionId)
                .userId(userId)
                .status(RefillRequest.STATUS_SUBMITTED)
                .build());
        rx.setRefillsRemaining(rx.getRefillsRemaining() - 1);

        log.info("[PrescriptionTools] Refill {} submitted for {} ({} refill(s) left)",
                refillRequestId, prescriptionId, rx.getRefillsRemaining());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("accepted", true);
        out.put("refill_request_id", refillRequestId);
        out.put("status", RefillRequest.STATUS_SUBMITTED);
        out.put("eta_hours", REFILL_ETA_HOURS);
        return out;
    }

    // ── query_prescriptions_flexible ─────────────────────────────────────────

    public Map<String, Object> queryPrescriptionsFlexible(ToolArguments args) {
        String medId   = args.string("med_id");
        String medName = args.string("med_name");
        if (medId == null && medName != null) {
            Optional<Medication> resolved = medicationTools.resolveUnique(medName);
            if (resolved.isEmpty()) return InventoryTools.medicationNotFound(medName);
            medId = resolved.get().getMedId();
        }

        LocalDate today = LocalDate.now(clock);
        Integer expiringSoonDays = args.optionalInteger("expiring_soon_days");
        Boolean hasRefills = args.bool("has_refills");
        int limit = args.integer("limit", DEFAULT_LIMIT);
        if (limit <= 0) limit = DEFAULT_LIMIT;

        Specification<Prescription> filter = allOf(
                equalTo("userId", args.string("user_id")),
                equalTo("medId", medId),
                expiringWithin(today, expiringSoonDays),
                refillsAvailable(hasRefills));

        List<Map<String, Object>> rows = prescriptionRepository
                .findAll(filter, Sort.by("expiresAt", "userId")).stream()
                .limit(limit)
                .map(p -> {
                    Map<String, Object> row = baseRow(p);
                    row.put("user_id", p.getUserId());
                    row.put("status", p.status(today));
                    row.put("rx_required", p.getMedication().isRxRequired());
                    return row;
                })
                .toList();

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("count", rows.size());
        out.put("prescriptions", rows);
        return out;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Specification<Prescription> expiringWithin(LocalDate today, Integer days) {
        if (days == null) return null;
        return (root, query, cb) -> cb.between(root.get("expiresAt"), today, today.plusDays(days));
    }

    private static Specification<Prescription> refillsAvailable(Boolean hasRefills) {
        if (hasRefills == null) return null;
        return hasRefills
                ? (root, query, cb) -> cb.greaterThan(root.get("refillsRemaining"), 0)
                : (root, query, cb) -> cb.lessThanOrEqualTo(root.get("refillsRemaining"), 0);
    }

    private static Map<String, Object> baseRow(Prescription p) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("prescription_id", p.getPrescriptionId());
        row.put("med_id", p.getMedId());
        row.put("med_name", p.getMedication().displayName());
        row.put("directions", p.getDirections());
        row.put("refills_remaining", p.getRefillsRemaining());
        row.put("expires_at", p.getExpiresAt().toString());
        return row;
    }

    private static Map<String, Object> rejected(String reason) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("accepted", false);
        out.put("error", reason);
        return out;
    }
}
