package com.openforge.rxmate.pharmacy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.rxmate.agent.AgentProperties;
import com.openforge.rxmate.stats.ToolUsageCounter;
import com.openforge.rxmate.tool.ToolDescriptor;
import com.openforge.rxmate.tool.ToolHandler;
import com.openforge.rxmate.tool.ToolRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Wires the pharmacy tools into the {@link ToolRegistry}.
 *
 * Schemas (name, description, JSON Schema parameters) live in
 * {@code classpath:tools/pharmacy-tools.json}; handlers are bound here by
 * name. Required argument names come from each schema's {@code "required"}
 * array, in declaration order. A schema without a handler, or a handler
 * without a schema, stops the application from starting.
 */
@Slf4j
@Configuration
public class PharmacyToolCatalog {

    /** Explicit name → handler table. */
    static Map<String, ToolHandler> handlers(MedicationTools medications,
                                             InventoryTools inventory,
                                             PrescriptionTools prescriptions,
                                             UserTools users) {
        Map<String, ToolHandler> table = new LinkedHashMap<>();
        table.put("get_medication_by_name",       medications::getMedicationByName);
        table.put("list_medications",             medications::listMedications);
        table.put("search_users",                 users::searchUsers);
        table.put("check_stock_availability",     inventory::checkStockAvailability);
        table.put("list_user_prescriptions",      prescriptions::listUserPrescriptions);
        table.put("request_prescription_refill",  prescriptions::requestRefill);
        table.put("query_medications_flexible",   medications::queryMedicationsFlexible);
        table.put("query_medications_with_stock", inventory::queryMedicationsWithStock);
        table.put("query_stock_multiple_stores",  inventory::queryStockMultipleStores);
        table.put("list_stores",                  inventory::listStores);
        table.put("query_prescriptions_flexible", prescriptions::queryPrescriptionsFlexible);
        return table;
    }

    @Bean
    public ToolRegistry toolRegistry(AgentProperties properties,
                                     ObjectMapper objectMapper,
                                     MedicationTools medicationTools,
                                     InventoryTools inventoryTools,
                                     PrescriptionTools prescriptionTools,
                                     UserTools userTools,
                                     ToolUsageCounter usageCounter,
                                     TimeLimiter toolTimeLimiter,
                                     ExecutorService toolExecutor) {
        List<ToolDescriptor> descriptors = bind(readSchemas(properties.tools().schemas(), objectMapper),
                handlers(medicationTools, inventoryTools, prescriptionTools, userTools));
        return new ToolRegistry(descriptors, usageCounter, toolTimeLimiter, toolExecutor);
    }

    /** Pairs every schema with its handler, failing on any mismatch in either direction. */
    static List<ToolDescriptor> bind(JsonNode schemas, Map<String, ToolHandler> handlers) {
        if (schemas == null || !schemas.isArray()) {
            throw new IllegalStateException("Tool schema document must be a JSON array");
        }
        List<ToolDescriptor> descriptors = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode schema : schemas) {
            String name = schema.path("name").asText(null);
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Tool schema without a name: " + schema);
            }
            ToolHandler handler = handlers.get(name);
            if (handler == null) {
                throw new IllegalStateException("No handler bound for tool schema '" + name + "'");
            }
            seen.add(name);

            JsonNode parameters = schema.path("parameters");
            List<String> required = new ArrayList<>();
            parameters.path("required").forEach(r -> required.add(r.asText()));

            descriptors.add(new ToolDescriptor(name, schema.path("description").asText(""),
                    parameters, required, handler));
        }
        for (String name : handlers.keySet()) {
            if (!seen.contains(name)) {
                throw new IllegalStateException("Handler '" + name + "' has no schema");
            }
        }
        return descriptors;
    }

    static JsonNode readSchemas(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            log.info("[ToolCatalog] Loaded {} tool schema(s) from {}", root.size(), resource.getDescription());
            return root;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read tool schemas from " + resource.getDescription(), e);
        }
    }
}
