package uimbt.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import uimbt.fingerprint.UrlPatterns;
import uimbt.model.ActionableElement;
import uimbt.model.ActionableElements;
import uimbt.model.UIState;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content key used to recognise the same screen across graphs produced by
 * different runs or by manual recording, where state ids and similarity
 * details differ.
 *
 * <p>Hashes the URL base, state type, the multiset of button roles, the
 * links' {@code role:name} pairs and the multiset of input roles. Link names
 * that are blank, numeric or contain {@code %} are data, not structure, and
 * reduce to the role.
 */
public final class ContentFingerprint {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private ContentFingerprint() {}

    public static String of(UIState state) {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("url_base", urlBase(state));
        key.put("state_type", state.getStateType().jsonValue());

        ActionableElements elements = state.getFingerprint() == null
                ? ActionableElements.empty()
                : state.getFingerprint().actionableElements();
        key.put("buttons", sortedRoles(elements.buttons()));
        key.put("links", linkStructure(elements.links()));
        key.put("inputs", sortedRoles(elements.inputs()));

        try {
            byte[] json = CANONICAL.writeValueAsBytes(key);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot compute content fingerprint for " + state.getId(), e);
        }
    }

    static String urlBase(UIState state) {
        if (state.getEntryUrl() != null && !state.getEntryUrl().isBlank()) {
            String base = UrlPatterns.urlBase(state.getEntryUrl());
            return base.isEmpty() ? UrlPatterns.ROOT : base;
        }
        return state.getFingerprint() == null ? UrlPatterns.ROOT : state.getFingerprint().urlPattern();
    }

    private static List<String> sortedRoles(List<ActionableElement> elements) {
        List<String> roles = new ArrayList<>();
        for (ActionableElement e : elements) roles.add(e.role());
        roles.sort(null);
        return roles;
    }

    private static List<String> linkStructure(List<ActionableElement> links) {
        List<String> out = new ArrayList<>();
        for (ActionableElement link : links) {
            String name = link.name().strip();
            boolean data = name.isEmpty() || name.matches("\\d+") || name.contains("%");
            out.add(data ? link.role() : link.role() + ":" + name);
        }
        out.sort(null);
        return out;
    }
}
