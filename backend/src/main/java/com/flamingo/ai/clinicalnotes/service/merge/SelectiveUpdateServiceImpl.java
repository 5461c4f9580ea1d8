package com.flamingo.ai.clinicalnotes.service.merge;

import com.flamingo.ai.clinicalnotes.config.NoteConfig;
import com.flamingo.ai.clinicalnotes.domain.enums.GatewayErrorKind;
import com.flamingo.ai.clinicalnotes.domain.enums.GenerationPhase;
import com.flamingo.ai.clinicalnotes.domain.enums.MergeState;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.domain.enums.ViolationKind;
import com.flamingo.ai.clinicalnotes.exception.GatewayException;
import com.flamingo.ai.clinicalnotes.exception.MergeCancelledException;
import com.flamingo.ai.clinicalnotes.exception.NoteConfigurationException;
import com.flamingo.ai.clinicalnotes.exception.ProvidersExhaustedException;
import com.flamingo.ai.clinicalnotes.service.compliance.ComplianceValidator;
import com.flamingo.ai.clinicalnotes.service.compliance.model.ComplianceViolation;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import com.flamingo.ai.clinicalnotes.service.compliance.model.ValidationResult;
import com.flamingo.ai.clinicalnotes.service.generation.GatewayCallExecutor;
import com.flamingo.ai.clinicalnotes.service.generation.GatewayPair;
import com.flamingo.ai.clinicalnotes.service.generation.GeneratedText;
import com.flamingo.ai.clinicalnotes.service.generation.GenerationGateway;
import com.flamingo.ai.clinicalnotes.service.generation.GenerationRequest;
import com.flamingo.ai.clinicalnotes.service.merge.SectionSplicer.SpliceResult;
import com.flamingo.ai.clinicalnotes.service.merge.SectionSplicer.SplicedSection;
import com.flamingo.ai.clinicalnotes.service.merge.model.ChangeRecord;
import com.flamingo.ai.clinicalnotes.service.merge.model.GenerationAttempt;
import com.flamingo.ai.clinicalnotes.service.merge.model.MergeMetadata;
import com.flamingo.ai.clinicalnotes.service.merge.model.MergeRequest;
import com.flamingo.ai.clinicalnotes.service.merge.model.MergedNote;
import com.flamingo.ai.clinicalnotes.service.merge.model.SelectionConfig;
import com.flamingo.ai.clinicalnotes.service.parsing.NoteRenderer;
import com.flamingo.ai.clinicalnotes.service.parsing.SectionParser;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;
import com.flamingo.ai.clinicalnotes.service.parsing.model.Section;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Selective update engine.
 *
 * <p>Runs a bounded state machine: build the request, generate (primary then fallback), clean and
 * re-parse the candidate, splice it into the previous note, validate, then at most one stricter
 * retry and at most one emergency sanitization of generator-sourced content. At most four provider
 * calls are made per merge. All per-merge state lives in a local {@link MergeContext}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SelectiveUpdateServiceImpl implements SelectiveUpdateService {

  static final String SANITIZED_SUFFIX = "; emergency sanitization applied";

  private final SectionParser sectionParser;
  private final ComplianceValidator complianceValidator;
  private final SectionSplicer sectionSplicer;
  private final CandidateTextCleaner candidateTextCleaner;
  private final GatewayCallExecutor gatewayCallExecutor;
  private final NoteConfig noteConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "notes.merge", description = "Time to produce a selectively updated note")
  public MergedNote mergeUpdate(MergeRequest request, GatewayPair gateways) {
    validateInputs(request, gateways);

    MergeContext ctx = new MergeContext(request, resolveTimeout(request));
    ctx.enter(MergeState.INIT);
    ctx.checkCancelled();

    ParsedNote previous = request.previousNote();
    SelectionConfig selection = request.selection();
    EmrProfile profile = request.profile();

    GenerationRequest generationRequest = buildRequest(request);
    ctx.enter(MergeState.REQUEST_BUILT);
    ctx.checkCancelled();

    if (selection.allPreserved()) {
      log.debug("No sections selected for update; skipping generation");
      ctx.warnings.add("no sections selected for update; generation skipped");
      ctx.enter(MergeState.SPLICING);
      SpliceResult splice = sectionSplicer.splice(previous, previous, selection, null, false);
      ctx.enter(MergeState.VALIDATING);
      ValidationResult validation = validate(splice, profile);
      return finish(ctx, splice, validation, profile);
    }

    ctx.enter(MergeState.GENERATING);
    GenerationOutcome first =
        generateWithFallback(gateways, generationRequest, GenerationPhase.INITIAL, ctx);
    if (!first.succeeded()) {
      ctx.enter(MergeState.FAILED);
      meterRegistry.counter("notes.merge.failed").increment();
      log.error(
          "Both providers failed: primary '{}' ({}), fallback '{}' ({})",
          first.primaryError().getProviderId(),
          first.primaryError().getKind(),
          first.fallbackError().getProviderId(),
          first.fallbackError().getKind());
      throw new ProvidersExhaustedException(first.primaryError(), first.fallbackError());
    }

    SpliceResult splice = reparseAndSplice(ctx, first, previous, selection, profile);
    ValidationResult validation = validate(splice, profile);
    ctx.checkCancelled();

    if (!validation.isValid() && noteConfig.getGeneration().isStrictRetryEnabled()) {
      List<ComplianceViolation> generatorViolations = generatorViolations(splice, profile);
      // A required type absent from the previous note cannot be produced by the splice.
      boolean recoverableStructural =
          validation.violations().stream()
              .anyMatch(
                  violation ->
                      violation.kind() == ViolationKind.MISSING_SECTION
                          && previous.contains(violation.sectionType()));
      if (recoverableStructural || !generatorViolations.isEmpty()) {
        RetryResult retry =
            retry(ctx, gateways, generationRequest, splice, validation, generatorViolations);
        splice = retry.splice();
        validation = retry.validation();
      }
    }

    if (!validation.isValid()) {
      List<ComplianceViolation> generatorViolations = generatorViolations(splice, profile);
      if (!generatorViolations.isEmpty()) {
        ctx.checkCancelled();
        ctx.enter(MergeState.SANITIZING);
        splice = sanitize(splice, profile);
        ctx.sanitized = true;
        meterRegistry.counter("notes.merge.sanitized").increment();
        validation = validate(splice, profile);
      }
    }

    return finish(ctx, splice, validation, profile);
  }

  private RetryResult retry(
      MergeContext ctx,
      GatewayPair gateways,
      GenerationRequest generationRequest,
      SpliceResult splice,
      ValidationResult validation,
      List<ComplianceViolation> generatorViolations) {

    ctx.enter(MergeState.RETRY_GENERATING);
    ctx.retried = true;
    meterRegistry.counter("notes.merge.retry").increment();

    List<String> violationsToAvoid = new ArrayList<>();
    for (ComplianceViolation violation : validation.violations()) {
      if (violation.kind() == ViolationKind.MISSING_SECTION) {
        violationsToAvoid.add(violation.describe());
      }
    }
    generatorViolations.forEach(violation -> violationsToAvoid.add(violation.describe()));

    List<SectionType> retrySections = stillSelectedTypes(splice);
    log.warn(
        "Note failed compliance ({} errors); retrying strictly for sections {}",
        validation.errors().size(),
        retrySections);

    GenerationRequest strictRequest =
        generationRequest.strictRetry(retrySections, violationsToAvoid);
    GenerationOutcome outcome =
        generateWithFallback(gateways, strictRequest, GenerationPhase.STRICT_RETRY, ctx);
    if (!outcome.succeeded()) {
      log.warn("Strict retry could not reach any provider; keeping the first attempt");
      ctx.warnings.add("strict retry could not reach any provider; first attempt kept");
      return new RetryResult(splice, validation);
    }

    MergeRequest request = ctx.request;
    SpliceResult retried =
        reparseAndSplice(
            ctx, outcome, request.previousNote(), request.selection(), request.profile());
    return new RetryResult(retried, validate(retried, request.profile()));
  }

  private SpliceResult reparseAndSplice(
      MergeContext ctx,
      GenerationOutcome outcome,
      ParsedNote previous,
      SelectionConfig selection,
      EmrProfile profile) {
    ctx.checkCancelled();
    ctx.enter(MergeState.REPARSING);
    ctx.providerId = outcome.text().providerId();
    ctx.fallbackUsed = outcome.fallbackUsed();
    ParsedNote candidate =
        sectionParser.parse(candidateTextCleaner.clean(outcome.text().text()), profile);
    log.debug(
        "Candidate from '{}' parsed into {} sections", ctx.providerId, candidate.sections().size());

    ctx.checkCancelled();
    ctx.enter(MergeState.SPLICING);
    SpliceResult splice =
        sectionSplicer.splice(previous, candidate, selection, ctx.providerId, ctx.fallbackUsed);

    ctx.checkCancelled();
    ctx.enter(MergeState.VALIDATING);
    return splice;
  }

  /**
   * Calls the primary provider, then the fallback once if the primary fails. Never throws a
   * gateway failure; the outcome carries both errors when neither provider answered.
   */
  private GenerationOutcome generateWithFallback(
      GatewayPair gateways, GenerationRequest request, GenerationPhase phase, MergeContext ctx) {
    GatewayException primaryError;
    try {
      GeneratedText text = call(gateways.primary(), request, phase, false, ctx);
      return GenerationOutcome.success(text, false);
    } catch (GatewayException e) {
      primaryError = e;
    }

    ctx.checkCancelled();
    meterRegistry.counter("notes.merge.fallback").increment();
    log.warn(
        "Primary provider '{}' failed ({}); trying fallback '{}'",
        primaryError.getProviderId(),
        primaryError.getKind(),
        gateways.fallback().providerId());
    try {
      GeneratedText text = call(gateways.fallback(), request, phase, true, ctx);
      return GenerationOutcome.success(text, true);
    } catch (GatewayException e) {
      return GenerationOutcome.failure(primaryError, e);
    }
  }

  private GeneratedText call(
      GenerationGateway gateway,
      GenerationRequest request,
      GenerationPhase phase,
      boolean fallback,
      MergeContext ctx) {
    String providerId = gateway.providerId();
    try {
      GeneratedText text = gatewayCallExecutor.call(asGateway(gateway), request, ctx.timeout);
      ctx.attempts.add(new GenerationAttempt(phase, providerId, fallback, true, null, null));
      return text;
    } catch (GatewayException e) {
      ctx.attempts.add(
          new GenerationAttempt(phase, providerId, fallback, false, e.getKind(), e.getMessage()));
      throw e;
    }
  }

  /** Normalizes gateway misbehaviour (blank text, foreign exceptions) into gateway errors. */
  private static GenerationGateway asGateway(GenerationGateway gateway) {
    return new GenerationGateway() {
      @Override
      public String providerId() {
        return gateway.providerId();
      }

      @Override
      public GeneratedText generate(GenerationRequest request) {
        GeneratedText text;
        try {
          text = gateway.generate(request);
        } catch (GatewayException e) {
          throw e;
        } catch (RuntimeException e) {
          throw new GatewayException(
              GatewayErrorKind.PROVIDER_ERROR,
              gateway.providerId(),
              "Provider call failed: " + e.getMessage(),
              e);
        }
        if (text == null || text.text() == null || text.text().isBlank()) {
          throw new GatewayException(
              GatewayErrorKind.EMPTY_RESPONSE,
              gateway.providerId(),
              "Provider returned an empty note");
        }
        return text.providerId() == null
            ? new GeneratedText(text.text(), gateway.providerId())
            : text;
      }
    };
  }

  private SpliceResult sanitize(SpliceResult splice, EmrProfile profile) {
    List<SplicedSection> sanitized = new ArrayList<>();
    for (SplicedSection section : splice.sections()) {
      if (!section.hasGeneratedContent()
          || complianceValidator
              .findTokenViolations(section.generatedPortion(), profile)
              .isEmpty()) {
        sanitized.add(section);
        continue;
      }
      String cleanPortion = complianceValidator.sanitize(section.generatedPortion(), profile);
      String content =
          sectionSplicer.reassemble(
              section.previous().content(), cleanPortion, section.strategy());
      log.warn(
          "Emergency sanitization applied to section {} from provider '{}'",
          section.previous().type(),
          section.providerId());
      sanitized.add(
          section.withSanitizedPortion(
              sectionSplicer.withContent(section.previous(), content),
              cleanPortion,
              SANITIZED_SUFFIX));
    }
    return new SpliceResult(sanitized, splice.warnings());
  }

  /** Token violations found in generator-sourced content, attributed to their sections. */
  private List<ComplianceViolation> generatorViolations(SpliceResult splice, EmrProfile profile) {
    List<ComplianceViolation> violations = new ArrayList<>();
    for (SplicedSection section : splice.sections()) {
      if (!section.hasGeneratedContent()) {
        continue;
      }
      for (ComplianceViolation violation :
          complianceValidator.findTokenViolations(section.generatedPortion(), profile)) {
        violations.add(violation.withSection(section.previous().type()));
      }
    }
    return violations;
  }

  /** Selected types the first attempt produced plus those it omitted, in note order. */
  private static List<SectionType> stillSelectedTypes(SpliceResult splice) {
    Set<SectionType> types = EnumSet.noneOf(SectionType.class);
    List<SectionType> ordered = new ArrayList<>();
    for (SplicedSection section : splice.sections()) {
      if ((section.hasGeneratedContent() || section.omitted())
          && types.add(section.previous().type())) {
        ordered.add(section.previous().type());
      }
    }
    return ordered;
  }

  private ValidationResult validate(SpliceResult splice, EmrProfile profile) {
    return complianceValidator.validate(NoteRenderer.render(splice.outputSections()), profile);
  }

  private MergedNote finish(
      MergeContext ctx, SpliceResult splice, ValidationResult validation, EmrProfile profile) {
    ctx.checkCancelled();
    ctx.warnings.addAll(splice.warnings());

    long omitted = splice.omittedCount();
    if (omitted > 0) {
      meterRegistry.counter("notes.merge.omitted_sections").increment(omitted);
      log.warn("Regenerated note omitted {} selected sections", omitted);
    }
    if (!validation.isValid()) {
      boolean missingSections =
          validation.violations().stream()
              .anyMatch(violation -> violation.kind() == ViolationKind.MISSING_SECTION);
      boolean tokens =
          validation.violations().stream()
              .anyMatch(violation -> violation.kind() == ViolationKind.FORBIDDEN_TOKEN);
      if (missingSections) {
        ctx.warnings.add("required sections are missing from the previous note");
      }
      if (tokens) {
        ctx.warnings.add("compliance violations remain in preserved content");
      }
      log.warn(
          "Merged note for profile {} still has {} compliance errors",
          profile.id(),
          validation.errors().size());
    }

    List<ChangeRecord> ledger = new ArrayList<>();
    for (SplicedSection section : splice.sections()) {
      ledger.add(
          new ChangeRecord(
              section.previous().type(),
              section.output().order(),
              section.action(),
              section.previous().content(),
              section.output().content(),
              section.reason(),
              section.confidence(),
              section.providerId()));
    }

    ctx.enter(MergeState.DONE);
    List<Section> sections = splice.outputSections();
    MergeMetadata metadata =
        new MergeMetadata(
            ctx.providerId,
            ctx.fallbackUsed,
            ctx.retried,
            ctx.sanitized,
            ctx.attempts,
            ctx.trace,
            ctx.warnings);
    log.info(
        "Merged note for profile {}: provider={}, fallback={}, retried={}, sanitized={}, valid={}",
        profile.id(),
        ctx.providerId,
        ctx.fallbackUsed,
        ctx.retried,
        ctx.sanitized,
        validation.isValid());
    return new MergedNote(NoteRenderer.render(sections), sections, ledger, validation, metadata);
  }

  private GenerationRequest buildRequest(MergeRequest request) {
    List<SectionType> selected = new ArrayList<>();
    for (Section section : request.previousNote().sections()) {
      if (request.selection().isSelected(section.type()) && !selected.contains(section.type())) {
        selected.add(section.type());
      }
    }
    return new GenerationRequest(
        NoteRenderer.render(request.previousNote()),
        request.transcript() == null ? "" : request.transcript(),
        selected,
        request.profile().id(),
        request.profile().ruleNames(),
        false,
        List.of());
  }

  private Duration resolveTimeout(MergeRequest request) {
    return request.callTimeout() != null
        ? request.callTimeout()
        : noteConfig.getGeneration().getCallTimeout();
  }

  private static void validateInputs(MergeRequest request, GatewayPair gateways) {
    if (request == null) {
      throw new NoteConfigurationException("Merge request is required");
    }
    if (request.previousNote() == null) {
      throw new NoteConfigurationException("Previous note is required");
    }
    EmrProfile profile = request.profile();
    if (profile == null || profile.id() == null || profile.id().isBlank()) {
      throw new NoteConfigurationException("EMR profile with an id is required");
    }
    if (profile.aliasTable() == null) {
      throw new NoteConfigurationException(
          "EMR profile '" + profile.id() + "' has no alias table");
    }
    if (request.selection() == null) {
      throw new NoteConfigurationException("Section selection is required");
    }
    if (request.callTimeout() != null
        && (request.callTimeout().isZero() || request.callTimeout().isNegative())) {
      throw new NoteConfigurationException("Call timeout must be positive");
    }
    if (gateways == null || gateways.primary() == null || gateways.fallback() == null) {
      throw new NoteConfigurationException("Primary and fallback providers are required");
    }

    Set<SectionType> present = request.previousNote().sectionTypes();
    for (SectionType type : request.selection().configuredTypes()) {
      if (!present.contains(type)) {
        throw new NoteConfigurationException(
            "Selection references section " + type + " which is not in the previous note");
      }
    }
  }

  private record RetryResult(SpliceResult splice, ValidationResult validation) {}

  private record GenerationOutcome(
      GeneratedText text,
      boolean fallbackUsed,
      GatewayException primaryError,
      GatewayException fallbackError) {

    static GenerationOutcome success(GeneratedText text, boolean fallbackUsed) {
      return new GenerationOutcome(text, fallbackUsed, null, null);
    }

    static GenerationOutcome failure(GatewayException primary, GatewayException fallback) {
      return new GenerationOutcome(null, false, primary, fallback);
    }

    boolean succeeded() {
      return text != null;
    }
  }

  /** Mutable state of one merge invocation. Never shared between threads. */
  private static final class MergeContext {
    private final MergeRequest request;
    private final Duration timeout;
    private final List<MergeState> trace = new ArrayList<>();
    private final List<GenerationAttempt> attempts = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private String providerId;
    private boolean fallbackUsed;
    private boolean retried;
    private boolean sanitized;

    private MergeContext(MergeRequest request, Duration timeout) {
      this.request = request;
      this.timeout = timeout;
    }

    private void enter(MergeState state) {
      trace.add(state);
    }

    private MergeState current() {
      return trace.isEmpty() ? MergeState.INIT : trace.get(trace.size() - 1);
    }

    private void checkCancelled() {
      if (request.cancellationToken().isCancelled()) {
        log.info("Merge cancelled during {}", current());
        throw new MergeCancelledException(current());
      }
    }
  }
}
