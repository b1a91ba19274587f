package uimbt.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * The subset of a fingerprint a test step checks to confirm it is in a state:
 * URL pattern, title, main heading and landmark roles.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationLogic(
        @JsonProperty("url_pattern") String urlPattern,
        @JsonProperty("title") String title,
        @JsonProperty("main_heading") String mainHeading,
        @JsonProperty("landmark_roles") Set<String> landmarkRoles) {

    public static VerificationLogic from(Fingerprint fp) {
        Set<String> landmarks = fp.hasAccessibilitySummary()
                ? fp.accessibilitySummary().landmarkRoles()
                : Set.of();
        return new VerificationLogic(fp.urlPattern(), fp.title(), fp.mainHeading(), landmarks);
    }
}
