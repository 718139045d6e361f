package com.kazi.lifecycle.common.lifecycle;

import com.kazi.lifecycle.common.codec.DateOrderValidator;
import com.kazi.lifecycle.common.codec.OfferDetailsCodec;
import com.kazi.lifecycle.common.domain.enums.ApplicationField;
import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;
import com.kazi.lifecycle.common.domain.model.Application;
import com.kazi.lifecycle.common.domain.model.OfferDetails;
import com.kazi.lifecycle.common.time.Clock;
import com.kazi.lifecycle.common.transition.StatusTransitionAuthority;
import com.kazi.lifecycle.common.transition.TransitionError;
import com.kazi.lifecycle.common.transition.TransitionFields;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class ApplicationLifecycleServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 15);
    private static final Clock FIXED = () -> TODAY;

    private final OfferDetailsCodec codec = new OfferDetailsCodec();

    private final ApplicationLifecycleService service = service(false);

    private ApplicationLifecycleService service(boolean autoStamp) {
        return new ApplicationLifecycleService(
                new StatusTransitionAuthority(), new DateOrderValidator(), codec, FIXED, autoStamp);
    }

    private static Application.ApplicationBuilder app(ApplicationStatus status) {
        return Application.builder().id("A-1").status(status);
    }

    @Test
    void applyingFromSavedBuildsPatch() {
        LifecycleResult result = service.prepare(
                app(ApplicationStatus.SAVED).build(),
                ApplicationStatus.APPLIED,
                TransitionFields.builder().appliedDate(LocalDate.of(2025, 1, 1)).build());

        assertThat(result.isSuccess()).isTrue();
        ApplicationPatch patch = ((LifecycleResult.Success) result).patch();
        assertThat(patch.applicationId()).isEqualTo("A-1");
        assertThat(patch.expectedStatus()).isEqualTo(ApplicationStatus.SAVED);
        assertThat(patch.newStatus()).isEqualTo(ApplicationStatus.APPLIED);
        assertThat(patch.attributes()).containsExactly(entry("appliedDate", LocalDate.of(2025, 1, 1)));
        assertThat(patch.removedAttributes()).isEmpty();
    }

    @Test
    void recordValuesSatisfyTheContract() {
        Application current = app(ApplicationStatus.APPLIED)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.INTERVIEW,
                TransitionFields.builder().interviewDate(LocalDate.of(2025, 1, 10)).build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(((LifecycleResult.Success) result).patch().attributes())
                .containsOnlyKeys("interviewDate");
    }

    @Test
    void fieldsOfUnreachedStatusesAreDenied() {
        Application current = app(ApplicationStatus.APPLIED).appliedDate(LocalDate.of(2025, 1, 1)).build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.INTERVIEW, TransitionFields.builder()
                .interviewDate(LocalDate.of(2025, 1, 5))
                .offerDate(LocalDate.of(2025, 1, 9))
                .rejectedDate(LocalDate.of(2025, 1, 10))
                .offerDetails(OfferDetails.builder().title("X").build())
                .build());

        assertThat(result).isEqualTo(new LifecycleResult.Failure(new TransitionError.UnreachedStatusFields(
                ApplicationStatus.INTERVIEW,
                List.of(ApplicationField.OFFER_DATE, ApplicationField.REJECTED_DATE, ApplicationField.OFFER_DETAILS))));
    }

    @Test
    void fieldsOfReachedStatusesCanBeCorrected() {
        Application current = app(ApplicationStatus.INTERVIEW)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .interviewDate(LocalDate.of(2025, 1, 10))
                .build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.REJECTED, TransitionFields.builder()
                .interviewDate(LocalDate.of(2025, 1, 11))
                .rejectionReason("No feedback")
                .rejectedDate(LocalDate.of(2025, 1, 20))
                .build());

        assertThat(((LifecycleResult.Success) result).patch().attributes())
                .containsOnlyKeys("interviewDate", "rejectedDate", "rejectionReason");
    }

    @Test
    void offerWithoutDateAndTitleFailsListingBoth() {
        Application current = app(ApplicationStatus.INTERVIEW)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .interviewDate(LocalDate.of(2025, 1, 10))
                .build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.OFFER, TransitionFields.none());

        assertThat(result).isEqualTo(new LifecycleResult.Failure(new TransitionError.MissingRequiredFields(
                List.of(ApplicationField.OFFER_DATE, ApplicationField.OFFER_TITLE))));
    }

    @Test
    void offerPayloadIsEncodedIntoPatch() {
        Application current = app(ApplicationStatus.INTERVIEW)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .interviewDate(LocalDate.of(2025, 1, 10))
                .build();
        OfferDetails offer = OfferDetails.builder().title("Data Engineer").salary("300000").currency("KES").build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.OFFER, TransitionFields.builder()
                .offerDate(LocalDate.of(2025, 1, 20))
                .offerDetails(offer)
                .build());

        ApplicationPatch patch = ((LifecycleResult.Success) result).patch();
        String encoded = (String) patch.attributes().get(ApplicationPatch.ATTR_OFFER_DETAILS);
        assertThat(codec.decode(encoded)).isEqualTo(offer);
    }

    @Test
    void dateOrderViolationIsReported() {
        Application current = app(ApplicationStatus.INTERVIEW)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .interviewDate(LocalDate.of(2025, 1, 10))
                .build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.OFFER, TransitionFields.builder()
                .offerDate(LocalDate.of(2025, 1, 5))
                .offerDetails(OfferDetails.builder().title("SRE").build())
                .build());

        assertThat(result).isEqualTo(new LifecycleResult.Failure(new TransitionError.DateOrderViolation(
                ApplicationField.INTERVIEW_DATE, ApplicationField.OFFER_DATE)));
    }

    @Test
    void illegalTransitionIsReportedBeforeFields() {
        LifecycleResult result = service.prepare(
                app(ApplicationStatus.SAVED).build(), ApplicationStatus.OFFER, TransitionFields.none());

        assertThat(result).isEqualTo(new LifecycleResult.Failure(
                new TransitionError.IllegalTransition(ApplicationStatus.SAVED, ApplicationStatus.OFFER)));
    }

    @Test
    void rejectingFromAppliedNeedsNoInterviewDate() {
        Application current = app(ApplicationStatus.APPLIED).appliedDate(LocalDate.of(2025, 1, 1)).build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.REJECTED, TransitionFields.builder()
                .rejectionReason("Budget constraints")
                .rejectedDate(LocalDate.of(2025, 1, 4))
                .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(((LifecycleResult.Success) result).patch().attributes())
                .containsEntry("rejectionReason", "Budget constraints")
                .containsEntry("rejectedDate", LocalDate.of(2025, 1, 4));
    }

    @Test
    void rejectingFromOfferWithoutInterviewDateOnRecordFails() {
        Application current = app(ApplicationStatus.OFFER)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .offerDate(LocalDate.of(2025, 1, 20))
                .offerDetails(codec.encode(OfferDetails.builder().title("Dev").build()))
                .build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.REJECTED, TransitionFields.builder()
                .rejectionReason("Culture fit")
                .rejectedDate(LocalDate.of(2025, 2, 1))
                .build());

        assertThat(result).isEqualTo(new LifecycleResult.Failure(
                new TransitionError.MissingRequiredFields(List.of(ApplicationField.INTERVIEW_DATE))));
    }

    @Test
    void corruptStoredOfferDoesNotBlockRejection() {
        Application current = app(ApplicationStatus.OFFER)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .interviewDate(LocalDate.of(2025, 1, 10))
                .offerDate(LocalDate.of(2025, 1, 20))
                .offerDetails("{broken")
                .build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.REJECTED, TransitionFields.builder()
                .rejectionReason("Already filled")
                .rejectedDate(LocalDate.of(2025, 2, 1))
                .build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(((LifecycleResult.Success) result).patch().attributes())
                .doesNotContainKey(ApplicationPatch.ATTR_OFFER_DETAILS);
    }

    @Test
    void storedOfferPayloadIsLeftUntouchedOnRejection() {
        String legacy = "{\"salary\":150000,\"company_name\":\"Acme\",\"title\":\"Dev\"}";
        Application current = app(ApplicationStatus.OFFER)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .interviewDate(LocalDate.of(2025, 1, 10))
                .offerDate(LocalDate.of(2025, 1, 20))
                .offerDetails(legacy)
                .build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.REJECTED, TransitionFields.builder()
                .rejectionReason("Different priorities")
                .rejectedDate(LocalDate.of(2025, 2, 1))
                .build());

        ApplicationPatch patch = ((LifecycleResult.Success) result).patch();
        assertThat(patch.attributes()).doesNotContainKey(ApplicationPatch.ATTR_OFFER_DETAILS);
        assertThat(patch.removedAttributes()).isEmpty();
    }

    @Test
    void reapplyingWithoutNewDateKeepsHistory() {
        Application current = app(ApplicationStatus.REJECTED)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .interviewDate(LocalDate.of(2025, 1, 10))
                .rejectedDate(LocalDate.of(2025, 1, 15))
                .rejectionReason("Overqualified")
                .build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.APPLIED, TransitionFields.none());

        ApplicationPatch patch = ((LifecycleResult.Success) result).patch();
        assertThat(patch.newStatus()).isEqualTo(ApplicationStatus.APPLIED);
        assertThat(patch.attributes()).isEmpty();
        assertThat(patch.removedAttributes()).isEmpty();
    }

    @Test
    void reapplyingWithLaterDateStartsANewCycle() {
        Application current = app(ApplicationStatus.REJECTED)
                .appliedDate(LocalDate.of(2025, 1, 1))
                .interviewDate(LocalDate.of(2025, 1, 10))
                .rejectedDate(LocalDate.of(2025, 1, 15))
                .rejectionReason("Overqualified")
                .build();

        LifecycleResult result = service.prepare(current, ApplicationStatus.APPLIED,
                TransitionFields.builder().appliedDate(LocalDate.of(2025, 3, 1)).build());

        ApplicationPatch patch = ((LifecycleResult.Success) result).patch();
        assertThat(patch.attributes()).containsExactly(entry("appliedDate", LocalDate.of(2025, 3, 1)));
        assertThat(patch.removedAttributes())
                .containsExactly("interviewDate", "rejectedDate", "rejectionReason");
    }

    @Test
    void autoStampFillsOnlyTheTargetDate() {
        Application current = app(ApplicationStatus.APPLIED).appliedDate(LocalDate.of(2025, 6, 1)).build();

        LifecycleResult result = service(true).prepare(current, ApplicationStatus.INTERVIEW, TransitionFields.none());

        assertThat(((LifecycleResult.Success) result).patch().attributes())
                .containsExactly(entry("interviewDate", TODAY));
    }

    @Test
    void autoStampKeepsSuppliedDate() {
        Application current = app(ApplicationStatus.SAVED).build();

        LifecycleResult result = service(true).prepare(current, ApplicationStatus.APPLIED,
                TransitionFields.builder().appliedDate(LocalDate.of(2025, 5, 5)).build());

        assertThat(((LifecycleResult.Success) result).patch().attributes())
                .containsEntry("appliedDate", LocalDate.of(2025, 5, 5));
    }

    @Test
    void autoStampStillRequiresRejectionReason() {
        Application current = app(ApplicationStatus.APPLIED).appliedDate(LocalDate.of(2025, 6, 1)).build();

        LifecycleResult result = service(true).prepare(current, ApplicationStatus.REJECTED, TransitionFields.none());

        assertThat(result).isEqualTo(new LifecycleResult.Failure(
                new TransitionError.MissingRequiredFields(List.of(ApplicationField.REJECTION_REASON))));
    }

    @Test
    void offerCanBeRevisedWhileInOffer() {
        Application current = app(ApplicationStatus.OFFER).build();
        OfferDetails revised = OfferDetails.builder().title("Lead").salary("400000").build();

        LifecycleResult result = service.reviseOffer(current, revised);

        ApplicationPatch patch = ((LifecycleResult.Success) result).patch();
        assertThat(patch.changesStatus()).isFalse();
        assertThat(codec.decode((String) patch.attributes().get(ApplicationPatch.ATTR_OFFER_DETAILS)))
                .isEqualTo(revised);
    }

    @Test
    void offerRevisionOutsideOfferFails() {
        LifecycleResult result = service.reviseOffer(
                app(ApplicationStatus.INTERVIEW).build(), OfferDetails.builder().title("Lead").build());

        assertThat(result).isEqualTo(new LifecycleResult.Failure(
                new TransitionError.IllegalTransition(ApplicationStatus.INTERVIEW, ApplicationStatus.OFFER)));
    }

    @Test
    void offerRevisionNeedsTitle() {
        LifecycleResult result = service.reviseOffer(app(ApplicationStatus.OFFER).build(), OfferDetails.empty());

        assertThat(result).isEqualTo(new LifecycleResult.Failure(
                new TransitionError.MissingRequiredFields(List.of(ApplicationField.OFFER_TITLE))));
    }
}
