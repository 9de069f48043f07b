package com.example.coverage.service;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.model.PolicyContext;
import com.example.coverage.model.PolicyholderType;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Company or individual, for VAT reclaim. A declared type wins; otherwise a legal-entity
 * suffix must appear as a whole token of the policyholder name ("Muster AG", not "Agathe").
 * Without either the policyholder is treated as an individual, which keeps VAT in the payout.
 */
@Service
public class PolicyholderClassifier {

    public record Classification(PolicyholderType type, PolicyholderType.Source source, String matchedSuffix) {
    }

    private final List<String> suffixes;

    public PolicyholderClassifier(CoverageProperties properties) {
        this.suffixes = properties.payout().companySuffixes();
    }

    public Classification classify(PolicyContext policy) {
        if (policy.policyholderType() != null) {
            return new Classification(policy.policyholderType(), PolicyholderType.Source.DECLARED, null);
        }
        String name = policy.policyholderName();
        if (name != null && !name.isBlank()) {
            for (String token : name.trim().split("[\\s,;()]+")) {
                for (String suffix : suffixes) {
                    if (sameSuffix(token, suffix)) {
                        return new Classification(PolicyholderType.COMPANY,
                                PolicyholderType.Source.SUFFIX_HEURISTIC, suffix);
                    }
                }
            }
        }
        return new Classification(PolicyholderType.INDIVIDUAL, PolicyholderType.Source.DEFAULT, null);
    }

    private static boolean sameSuffix(String token, String suffix) {
        if (token.equalsIgnoreCase(suffix)) return true;
        String bareToken = stripTrailingDot(token);
        String bareSuffix = stripTrailingDot(suffix);
        return !bareToken.isEmpty() && bareToken.equalsIgnoreCase(bareSuffix);
    }

    private static String stripTrailingDot(String s) {
        return s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
    }
}
