package org.wikidata.query.rdf.entitystore.lookup;

import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikidata.query.rdf.entitystore.common.Config;
import org.wikidata.query.rdf.entitystore.model.NerType;

import com.google.common.collect.ImmutableSet;

/**
 * Validates and normalizes the raw parameters of lookup requests.
 * Absent parameters are passed as null.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class ParamsValidator {

    public static final String DEFAULT_KG = "wikidata";
    public static final int DEFAULT_LIMIT = 1000;

    private static final Logger log = LoggerFactory.getLogger(ParamsValidator.class);

    private final String accessToken;
    private final ImmutableSet<String> supportedKgs;

    /**
     * @param accessToken the token clients must send; if null, every token is rejected
     * @param supportedKgs the knowledge graphs lookups can run on
     */
    public ParamsValidator(String accessToken, Set<String> supportedKgs) {
        this.accessToken = accessToken;
        this.supportedKgs = ImmutableSet.copyOf(supportedKgs);
        if (accessToken == null) log.warn("No access token configured: every request will be rejected");
    }

    /**
     * A validator expecting {@link Config#LOOKUP_ACCESS_TOKEN}.
     */
    public static ParamsValidator fromConfig(Set<String> supportedKgs) {
        return new ParamsValidator(Config.LOOKUP_ACCESS_TOKEN, supportedKgs);
    }

    public Validation<Void> validateToken(String token) {
        if (accessToken == null || !accessToken.equals(token)) return Validation.invalid("Invalid access token", Validation.FORBIDDEN);
        return Validation.valid(null);
    }

    /**
     * @return the knowledge graph, {@value #DEFAULT_KG} if none is given
     */
    public Validation<String> validateKg(String kg) {
        if (kg == null) return Validation.valid(DEFAULT_KG);
        if (!supportedKgs.contains(kg)) return Validation.invalid("Knowledge Graph Specification Error", Validation.BAD_REQUEST);
        return Validation.valid(kg);
    }

    /**
     * @return the limit, {@value #DEFAULT_LIMIT} if none is given
     */
    public Validation<Integer> validateLimit(String limit) {
        if (limit == null) return Validation.valid(DEFAULT_LIMIT);
        Integer parsed = parseInt(limit);
        if (parsed == null) return Validation.invalid("limit parameter cannot be converted to int", Validation.BAD_REQUEST);
        return Validation.valid(parsed);
    }

    /**
     * The number of candidates is required, there is no default.
     */
    public Validation<Integer> validateK(String k) {
        Integer parsed = k == null ? null : parseInt(k);
        if (parsed == null) return Validation.invalid("k parameter cannot be converted to int", Validation.BAD_REQUEST);
        return Validation.valid(parsed);
    }

    /**
     * @return {@code true} or {@code false}, case insensitive; false if none is given
     */
    public Validation<Boolean> validateBool(String value) {
        if (value == null) return Validation.valid(false);
        String lowerCase = value.toLowerCase(Locale.ROOT);
        if ("true".equals(lowerCase)) return Validation.valid(true);
        if ("false".equals(lowerCase)) return Validation.valid(false);
        return Validation.invalid("Bool parameter cannot be converted", Validation.BAD_REQUEST);
    }

    /**
     * @return the NER type, null if none is given
     */
    public Validation<NerType> validateNerType(String nerType) {
        if (nerType == null || nerType.isEmpty()) return Validation.valid(null);
        for (NerType type : NerType.values()) {
            if (type.name().equals(nerType)) return Validation.valid(type);
        }
        return Validation.invalid("NERtype parameter is not valid", Validation.BAD_REQUEST);
    }

    /**
     * Surrounding whitespace is allowed, as well as a sign.
     */
    private static Integer parseInt(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException nfe) {
            return null;
        }
    }
}
