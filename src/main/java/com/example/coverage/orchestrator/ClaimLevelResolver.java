package com.example.coverage.orchestrator;

import com.example.coverage.agent.PrimaryRepairAgent;
import com.example.coverage.agent.RepairAssociationAgent;
import com.example.coverage.config.ComponentVocabulary;
import com.example.coverage.config.CoverageProperties;
import com.example.coverage.config.PartCatalog;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.DeterminationMethod;
import com.example.coverage.model.ExclusionReason;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;
import com.example.coverage.model.PrimaryRepairResult;
import com.example.coverage.model.RepairAssociationResponse;
import com.example.coverage.model.RepairContext;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.PolicyMatcher;
import com.example.coverage.service.TermMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Claim-level arbitration over the cascade's verdicts. Runs once per claim after every
 * item-level call has completed.
 * <p>
 * States, in order:
 * <ol>
 *   <li>DETERMINE_PRIMARY: covered item, then repair context, then one LLM call</li>
 *   <li>VALIDATE_ASSOCIATION: one LLM call over LLM-denied parts when the labor names a covered repair</li>
 *   <li>ANCHOR_LABOR: promote ancillary parts and anchored labor, demote unanchored labor and labor
 *   serving excluded parts, flag nominal-price labor for review</li>
 *   <li>CONFIRM_PRIMARY: re-run the deterministic tiers if any verdict changed</li>
 *   <li>EXCLUDED_VETO: an excluded highest-value item forces primary coverage to false, whatever its verdict</li>
 * </ol>
 * Items resolved by the rule engine are never changed. Every change goes through
 * {@link LineItemCoverage#adjust} so the first verdict stays on the item.
 */
@Service
public class ClaimLevelResolver {

    private static final Logger log = LoggerFactory.getLogger(ClaimLevelResolver.class);

    static final double REPAIR_CONTEXT_CONFIDENCE = 0.80;
    static final double LABOR_BY_PART_CODE = 0.85;
    static final double LABOR_BY_REPAIR_KEYWORD = 0.80;
    static final double LABOR_BY_COMPONENT = 0.80;
    static final double LABOR_GENERIC = 0.75;
    static final double ANCILLARY_PART = 0.70;
    static final double PART_FOR_COVERED_REPAIR = 0.85;
    static final double NOMINAL_LABOR_CONFIDENCE = 0.30;
    static final BigDecimal NOMINAL_LABOR_PRICE = new BigDecimal("2.00");
    private static final int MIN_CODE_LENGTH = 4;

    enum State {
        DETERMINE_PRIMARY, VALIDATE_ASSOCIATION, ANCHOR_LABOR, CONFIRM_PRIMARY, EXCLUDED_VETO, DONE
    }

    public record Resolution(List<LineItemCoverage> lineItems, PrimaryRepairResult primaryRepair) {
        public Resolution {
            lineItems = List.copyOf(lineItems);
        }
    }

    private static final Comparator<LineItemCoverage> BY_VALUE = Comparator
            .comparing(LineItemCoverage::totalPrice)
            .thenComparing(Comparator.comparingInt(LineItemCoverage::index).reversed());

    private final PrimaryRepairAgent primaryRepairAgent;
    private final RepairAssociationAgent repairAssociationAgent;
    private final boolean llmEnabled;

    public ClaimLevelResolver(PrimaryRepairAgent primaryRepairAgent,
                              RepairAssociationAgent repairAssociationAgent,
                              CoverageProperties properties) {
        this.primaryRepairAgent = primaryRepairAgent;
        this.repairAssociationAgent = repairAssociationAgent;
        this.llmEnabled = properties.llm().enabled();
    }

    public Resolution resolve(List<LineItemCoverage> verdicts, ClaimContext context) {
        List<LineItemCoverage> items = new ArrayList<>(verdicts);
        PrimaryRepairResult primary = PrimaryRepairResult.none();
        boolean changed = false;
        State state = State.DETERMINE_PRIMARY;

        while (state != State.DONE) {
            log.debug("Claim {}: {}", context.claimId(), state);
            switch (state) {
                case DETERMINE_PRIMARY -> {
                    primary = deterministicPrimary(items, context)
                            .or(() -> llmEnabled ? primaryRepairAgent.determine(items, context) : Optional.empty())
                            .orElseGet(PrimaryRepairResult::none);
                    log.info("Primary repair: {} ({}), covered={}, via {}", primary.component(), primary.category(),
                            primary.isCovered(), primary.determinationMethod().value());
                    state = State.VALIDATE_ASSOCIATION;
                }
                case VALIDATE_ASSOCIATION -> {
                    changed |= validateAssociation(items, primary, context);
                    state = State.ANCHOR_LABOR;
                }
                case ANCHOR_LABOR -> {
                    changed |= anchor(items, primary, context);
                    state = State.CONFIRM_PRIMARY;
                }
                case CONFIRM_PRIMARY -> {
                    if (changed) {
                        Optional<PrimaryRepairResult> confirmed = deterministicPrimary(items, context);
                        if (confirmed.isPresent()) {
                            primary = confirmed.get();
                            log.info("Primary repair re-confirmed: {} via {}", primary.component(),
                                    primary.determinationMethod().value());
                        } else if (primary.determinationMethod() == DeterminationMethod.COVERED_ITEM) {
                            log.info("Primary repair '{}' lost its covered anchor", primary.component());
                            primary = PrimaryRepairResult.none();
                        }
                    }
                    state = State.EXCLUDED_VETO;
                }
                case EXCLUDED_VETO -> {
                    primary = applyVeto(items, primary, context.policyMatcher());
                    state = State.DONE;
                }
                default -> throw new IllegalStateException("Unexpected state " + state);
            }
        }
        return new Resolution(items, primary);
    }

    /**
     * Covered-item tier, then repair-context tier.
     */
    Optional<PrimaryRepairResult> deterministicPrimary(List<LineItemCoverage> items, ClaimContext context) {
        Optional<LineItemCoverage> coveredPart = items.stream()
                .filter(i -> i.isCovered() && i.isParts())
                .max(BY_VALUE);
        Optional<LineItemCoverage> anchor = coveredPart.isPresent()
                ? coveredPart
                : items.stream().filter(LineItemCoverage::isCovered).max(BY_VALUE);
        if (anchor.isPresent()) {
            LineItemCoverage item = anchor.get();
            return Optional.of(new PrimaryRepairResult(
                    item.matchedComponent() != null ? item.matchedComponent() : item.description(),
                    item.coverageCategory(), item.description(), Boolean.TRUE, item.matchConfidence(),
                    DeterminationMethod.COVERED_ITEM, item.index(), false,
                    "Highest-value covered " + item.itemType().value() + " item"));
        }

        RepairContext repair = context.repairContext();
        if (repair.isPresent()) {
            Integer source = items.stream()
                    .filter(i -> i.isLabor() && i.description().equals(repair.sourceDescription()))
                    .map(LineItemCoverage::index)
                    .findFirst().orElse(null);
            return Optional.of(new PrimaryRepairResult(repair.primaryComponent(), repair.primaryCategory(),
                    repair.sourceDescription(), repair.isCovered(), REPAIR_CONTEXT_CONFIDENCE,
                    DeterminationMethod.REPAIR_CONTEXT, source, false,
                    "Derived from labor description '" + repair.sourceDescription() + "'"));
        }
        return Optional.empty();
    }

    boolean validateAssociation(List<LineItemCoverage> items, PrimaryRepairResult primary, ClaimContext context) {
        if (!llmEnabled) return false;
        if (!context.repairContext().hasCoveredRepair()) return false;

        PolicyMatcher matcher = context.policyMatcher();
        Set<Integer> candidates = new LinkedHashSet<>();
        for (LineItemCoverage item : items) {
            if (item.isParts() && item.coverageStatus() == CoverageStatus.NOT_COVERED
                    && item.matchMethod() == MatchMethod.LLM
                    && !matcher.isExcluded(item.matchedComponent(), null, item.description())) {
                candidates.add(item.index());
            }
        }
        if (candidates.isEmpty()) return false;

        log.info("Validating {} LLM-denied parts against covered repair '{}'", candidates.size(),
                primary.component() != null ? primary.component() : context.repairContext().primaryComponent());
        Map<Integer, RepairAssociationResponse.Decision> decisions =
                repairAssociationAgent.validate(items, candidates, primary, context);

        boolean changed = false;
        String repairName = primary.component() != null ? primary.component()
                : context.repairContext().primaryComponent();
        String repairCategory = primary.category() != null ? primary.category()
                : context.repairContext().primaryCategory();
        for (Map.Entry<Integer, RepairAssociationResponse.Decision> entry : decisions.entrySet()) {
            RepairAssociationResponse.Decision decision = entry.getValue();
            if (!repairAssociationAgent.accepts(decision)) continue;
            LineItemCoverage item = items.get(entry.getKey());
            String component = decision.matchedComponent() != null ? decision.matchedComponent() : item.matchedComponent();
            String category = item.coverageCategory() != null && matcher.isCategoryCovered(item.coverageCategory())
                    ? item.coverageCategory() : repairCategory;
            items.set(item.index(), item.adjust(CoverageStatus.COVERED, category, component,
                    repairAssociationAgent.cappedConfidence(decision),
                    "[RESCUED: part of covered repair '" + repairName + "': "
                            + (decision.reasoning() != null ? decision.reasoning() : "associated") + "]"));
            log.info("Repair association: '{}' NOT_COVERED -> COVERED", item.description());
            changed = true;
        }
        return changed;
    }

    boolean anchor(List<LineItemCoverage> items, PrimaryRepairResult primary, ClaimContext context) {
        boolean changed = promoteAncillaryParts(items, context);
        changed |= promotePartsForCoveredRepair(items, context);

        List<LineItemCoverage> coveredParts = items.stream()
                .filter(i -> i.isCovered() && i.isParts())
                .toList();
        if (coveredParts.isEmpty()) {
            changed |= demoteUnanchoredLabor(items);
        } else {
            changed |= promoteAnchoredLabor(items, coveredParts, context);
            changed |= demoteLaborForExcludedParts(items, primary);
        }
        return flagNominalPriceLabor(items) || changed;
    }

    private boolean promoteAncillaryParts(List<LineItemCoverage> items, ClaimContext context) {
        RepairContext repair = context.repairContext();
        if (!repair.hasCoveredRepair()) return false;
        List<String> keywords = context.vocabulary().components().ancillaryKeywords();
        if (keywords.isEmpty()) return false;

        boolean changed = false;
        for (LineItemCoverage item : List.copyOf(items)) {
            if (!item.isParts() || item.isCovered() || item.matchMethod() == MatchMethod.RULE) continue;
            if (context.policyMatcher().isExcluded(item.matchedComponent(), null, item.description())) continue;
            Optional<String> keyword = keywords.stream()
                    .filter(k -> TermMatcher.containsTerm(item.description(), k))
                    .findFirst();
            if (keyword.isEmpty()) continue;
            items.set(item.index(), item.adjust(CoverageStatus.COVERED, repair.primaryCategory(),
                    repair.primaryComponent(), ANCILLARY_PART,
                    "[ANCILLARY: '" + keyword.get() + "' part of covered '" + repair.primaryComponent() + "' repair]"));
            log.info("Ancillary promotion: '{}' -> COVERED ({} repair)", item.description(), repair.primaryComponent());
            changed = true;
        }
        return changed;
    }

    private boolean promotePartsForCoveredRepair(List<LineItemCoverage> items, ClaimContext context) {
        RepairContext repair = context.repairContext();
        if (!repair.hasCoveredRepair()) return false;
        boolean coveredLaborInCategory = items.stream()
                .anyMatch(i -> i.isLabor() && i.isCovered() && i.coverageCategory() != null
                        && TermMatcher.isMatch(i.coverageCategory(), repair.primaryCategory()));
        if (!coveredLaborInCategory) return false;

        boolean changed = false;
        for (LineItemCoverage item : List.copyOf(items)) {
            if (!item.isParts() || item.coverageStatus() != CoverageStatus.NOT_COVERED
                    || item.matchMethod() != MatchMethod.LLM || item.coverageCategory() == null) continue;
            if (!TermMatcher.isMatch(item.coverageCategory(), repair.primaryCategory())) continue;
            if (context.policyMatcher().isExcluded(item.matchedComponent(), item.coverageCategory(), item.description())) {
                continue;
            }
            items.set(item.index(), item.adjust(CoverageStatus.COVERED, item.coverageCategory(), item.matchedComponent(),
                    PART_FOR_COVERED_REPAIR,
                    "[PROMOTED: part in category of covered repair '" + repair.primaryComponent() + "']"));
            log.info("Repair promotion: '{}' -> COVERED ({} labor covered)", item.description(), repair.primaryCategory());
            changed = true;
        }
        return changed;
    }

    private boolean promoteAnchoredLabor(List<LineItemCoverage> items, List<LineItemCoverage> coveredParts,
                                         ClaimContext context) {
        ComponentVocabulary vocabulary = context.vocabulary().components();
        PolicyMatcher matcher = context.policyMatcher();
        boolean changed = false;
        List<LineItemCoverage> genericLabor = new ArrayList<>();

        for (LineItemCoverage item : List.copyOf(items)) {
            if (!item.isLabor() || item.isCovered() || item.matchMethod() == MatchMethod.RULE) continue;
            if (matcher.isExcluded(item.matchedComponent(), null, item.description())) continue;

            Optional<LineItemCoverage> promoted = byPartCode(item, coveredParts)
                    .or(() -> byRepairKeyword(item, coveredParts, vocabulary))
                    .or(() -> byComponent(item, coveredParts));
            if (promoted.isPresent()) {
                items.set(item.index(), promoted.get());
                log.info("Labor promotion: '{}' -> COVERED", item.description());
                changed = true;
            } else if (isGenericLabor(item, vocabulary)) {
                genericLabor.add(item);
            }
        }

        if (genericLabor.size() == 1) {
            LineItemCoverage item = genericLabor.get(0);
            LineItemCoverage part = coveredParts.get(0);
            items.set(item.index(), item.adjust(CoverageStatus.COVERED, part.coverageCategory(), part.matchedComponent(),
                    LABOR_GENERIC, "[LABOR LINKED: single generic labor line for covered part '"
                            + part.description() + "']"));
            log.info("Labor promotion: generic '{}' linked to '{}'", item.description(), part.description());
            changed = true;
        } else if (genericLabor.size() > 1) {
            log.debug("{} generic labor lines, none linked", genericLabor.size());
        }
        return changed;
    }

    private static Optional<LineItemCoverage> byPartCode(LineItemCoverage labor, List<LineItemCoverage> coveredParts) {
        String description = PartCatalog.normalizeCode(labor.description());
        for (LineItemCoverage part : coveredParts) {
            String code = PartCatalog.normalizeCode(part.partCode());
            if (code.length() < MIN_CODE_LENGTH || !code.chars().allMatch(Character::isLetterOrDigit)) continue;
            if (description.contains(code)) {
                return Optional.of(labor.adjust(CoverageStatus.COVERED, part.coverageCategory(), part.matchedComponent(),
                        LABOR_BY_PART_CODE, "[LABOR LINKED: references code " + part.partCode()
                                + " of covered part '" + part.description() + "']"));
            }
        }
        return Optional.empty();
    }

    private static Optional<LineItemCoverage> byRepairKeyword(LineItemCoverage labor, List<LineItemCoverage> coveredParts,
                                                              ComponentVocabulary vocabulary) {
        for (Map.Entry<String, ComponentVocabulary.RepairKeyword> entry : vocabulary.repairContextKeywords().entrySet()) {
            if (!TermMatcher.containsTerm(labor.description(), entry.getKey())) continue;
            String category = entry.getValue().category();
            boolean anchored = coveredParts.stream()
                    .anyMatch(p -> p.coverageCategory() != null && TermMatcher.isMatch(p.coverageCategory(), category));
            if (anchored) {
                return Optional.of(labor.adjust(CoverageStatus.COVERED, category, entry.getValue().component(),
                        LABOR_BY_REPAIR_KEYWORD, "[LABOR LINKED: '" + entry.getKey()
                                + "' repair with covered parts in " + category + "]"));
            }
        }
        return Optional.empty();
    }

    private static Optional<LineItemCoverage> byComponent(LineItemCoverage labor, List<LineItemCoverage> coveredParts) {
        if (labor.matchedComponent() == null) return Optional.empty();
        for (LineItemCoverage part : coveredParts) {
            if (part.matchedComponent() != null && TermMatcher.isMatch(labor.matchedComponent(), part.matchedComponent())) {
                return Optional.of(labor.adjust(CoverageStatus.COVERED, part.coverageCategory(), part.matchedComponent(),
                        LABOR_BY_COMPONENT, "[LABOR LINKED: same component as covered part '"
                                + part.description() + "']"));
            }
        }
        return Optional.empty();
    }

    private static boolean isGenericLabor(LineItemCoverage item, ComponentVocabulary vocabulary) {
        return vocabulary.genericLaborDescriptions().stream()
                .anyMatch(g -> TermMatcher.containsTerm(item.description(), g));
    }

    private static boolean demoteUnanchoredLabor(List<LineItemCoverage> items) {
        boolean changed = false;
        for (LineItemCoverage item : List.copyOf(items)) {
            if (!item.isLabor() || !item.isCovered() || item.matchedComponent() == null
                    || item.matchMethod() == MatchMethod.RULE) continue;
            items.set(item.index(), item.adjust(CoverageStatus.NOT_COVERED, item.coverageCategory(),
                    item.matchedComponent(), item.matchConfidence(),
                    "[DEMOTED: no covered part anchors this labor]")
                    .withExclusionReason(ExclusionReason.DEMOTED_NO_ANCHOR));
            log.info("Labor demotion: '{}' -> NOT_COVERED (no covered part)", item.description());
            changed = true;
        }
        return changed;
    }

    /**
     * Covered labor follows the part it serves: labor matching the component of a policy-excluded
     * part, or its category when no covered part shares that category, is denied. Labor tied to the
     * covered primary repair is kept.
     */
    boolean demoteLaborForExcludedParts(List<LineItemCoverage> items, PrimaryRepairResult primary) {
        List<LineItemCoverage> excludedParts = items.stream()
                .filter(i -> i.isParts() && i.coverageStatus() == CoverageStatus.NOT_COVERED
                        && i.exclusionReason() != null && i.exclusionReason().isPolicyExclusion())
                .toList();
        if (excludedParts.isEmpty()) return false;

        boolean changed = false;
        for (LineItemCoverage item : List.copyOf(items)) {
            if (!item.isLabor() || !item.isCovered() || item.matchMethod() == MatchMethod.RULE) continue;
            if (Boolean.TRUE.equals(primary.isCovered()) && item.matchedComponent() != null
                    && primary.component() != null && TermMatcher.isMatch(item.matchedComponent(), primary.component())) {
                continue;
            }
            Optional<LineItemCoverage> served = excludedParts.stream()
                    .filter(part -> sameComponent(item, part))
                    .findFirst()
                    .or(() -> excludedParts.stream()
                            .filter(part -> sameCategory(item, part))
                            .filter(part -> items.stream().noneMatch(p -> p.isParts() && p.isCovered() && sameCategory(p, part)))
                            .findFirst());
            if (served.isEmpty()) continue;

            LineItemCoverage part = served.get();
            items.set(item.index(), item.adjust(CoverageStatus.NOT_COVERED, item.coverageCategory(),
                            item.matchedComponent(), item.matchConfidence(),
                            "[DEMOTED: labor serves excluded part '" + part.description() + "']")
                    .withExclusionReason(ExclusionReason.LABOR_FOR_EXCLUDED_PART));
            log.info("Labor demotion: '{}' -> NOT_COVERED (serves excluded '{}')", item.description(), part.description());
            changed = true;
        }
        return changed;
    }

    /**
     * Labor priced at a token amount with an operation code is missing its hours and rate, so it
     * cannot be paid as billed.
     */
    boolean flagNominalPriceLabor(List<LineItemCoverage> items) {
        boolean changed = false;
        for (LineItemCoverage item : List.copyOf(items)) {
            if (!item.isLabor() || !item.isCovered()) continue;
            if (item.partCode() == null || item.partCode().isBlank()) continue;
            if (item.totalPrice().signum() <= 0 || item.totalPrice().compareTo(NOMINAL_LABOR_PRICE) > 0) continue;
            items.set(item.index(), item.adjust(CoverageStatus.REVIEW_NEEDED, item.coverageCategory(),
                            item.matchedComponent(), NOMINAL_LABOR_CONFIDENCE,
                            "[REVIEW: nominal price " + item.totalPrice().toPlainString()
                                    + " with operation code " + item.partCode() + ", hourly rate missing]")
                    .withExclusionReason(ExclusionReason.NOMINAL_PRICE_LABOR));
            log.info("Nominal-price labor: '{}' ({}) -> REVIEW_NEEDED", item.description(), item.totalPrice());
            changed = true;
        }
        return changed;
    }

    private static boolean sameComponent(LineItemCoverage a, LineItemCoverage b) {
        return a.matchedComponent() != null && b.matchedComponent() != null
                && TermMatcher.isMatch(a.matchedComponent(), b.matchedComponent());
    }

    private static boolean sameCategory(LineItemCoverage a, LineItemCoverage b) {
        return a.coverageCategory() != null && b.coverageCategory() != null
                && TermMatcher.isMatch(a.coverageCategory(), b.coverageCategory());
    }

    PrimaryRepairResult applyVeto(List<LineItemCoverage> items, PrimaryRepairResult primary, PolicyMatcher matcher) {
        Optional<LineItemCoverage> highest = items.stream().max(BY_VALUE);
        if (highest.isEmpty()) return primary;
        LineItemCoverage item = highest.get();
        if (!matcher.isExcluded(item.matchedComponent(), null, item.description())) return primary;
        String reason = "Highest-value item '" + item.description() + "' (" + item.totalPrice().toPlainString()
                + ") is an excluded component; claim-level coverage is false";
        log.info("Excluded-component veto: {}", reason);
        return primary.vetoed(item, reason);
    }
}
