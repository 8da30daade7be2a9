package com.openforge.rxmate.pharmacy;

import com.openforge.rxmate.domain.PharmacyUser;
import com.openforge.rxmate.repository.PharmacyUserRepository;
import com.openforge.rxmate.tool.ToolArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.openforge.rxmate.pharmacy.PharmacySpecifications.*;

@Component
@RequiredArgsConstructor
public class UserTools {

    static final int MAX_RESULTS = 10;

    private final PharmacyUserRepository userRepository;

    /** Any of the given selectors may match (OR); at least one is required. */
    public Map<String, Object> searchUsers(ToolArguments args) {
        Specification<PharmacyUser> filter = anyOf(
                equalTo("userId", args.string("user_id")),
                containsIgnoreCase("fullName", args.string("name")),
                containsIgnoreCase("email", args.string("email")),
                containsIgnoreCase("phone", args.string("phone")));
        if (filter == null) {
            return Map.of("error", "At least one search parameter (name, email, phone, or user_id) must be provided");
        }

        List<PharmacyUser> users = userRepository.findAll(filter, Sort.by("fullName")).stream()
                .limit(MAX_RESULTS)
                .toList();

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("count", users.size());
        out.put("users", users.stream().map(u -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("user_id", u.getUserId());
            row.put("full_name", u.getFullName());
            row.put("phone", u.getPhone());
            row.put("email", u.getEmail());
            row.put("preferred_language", u.getPreferredLanguage());
            return row;
        }).toList());
        return out;
    }
}
