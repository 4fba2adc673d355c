package ca.nestsync.service;

import ca.nestsync.config.AppSettings;
import ca.nestsync.dto.request.UpdateConsentInput;
import ca.nestsync.entity.ConsentAuditLog;
import ca.nestsync.entity.ConsentRecord;
import ca.nestsync.entity.ConsentRecord.ConsentStatus;
import ca.nestsync.entity.ConsentRecord.ConsentType;
import ca.nestsync.entity.UserProfile;
import ca.nestsync.entity.UserProfile.UserStatus;
import ca.nestsync.repository.ConsentAuditLogRepository;
import ca.nestsync.repository.ConsentRecordRepository;
import ca.nestsync.repository.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * PIPEDA consent management.
 *
 * Each user holds at most one record per {@link ConsentType}. Every grant and
 * withdrawal is appended to the consent audit log with the previous and new
 * status. A grant is valid for 12 months.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConsentService {

    static final int CONSENT_VALIDITY_MONTHS = 12;

    private final ConsentRecordRepository consentRecordRepository;
    private final ConsentAuditLogRepository consentAuditLogRepository;
    private final UserProfileRepository userProfileRepository;
    private final AppSettings appSettings;

    @Transactional(readOnly = true)
    public List<ConsentRecord> getConsents(UserProfile user) {
        return consentRecordRepository.findByUserIdOrderByConsentTypeAsc(user.getId());
    }

    /**
     * Record the consents given on the sign-up form.
     */
    @Transactional
    public void recordSignUpConsents(UserProfile user, boolean marketing, boolean analytics) {
        grant(user, ConsentType.PRIVACY_POLICY, "sign_up");
        grant(user, ConsentType.TERMS_OF_SERVICE, "sign_up");
        if (marketing) {
            grant(user, ConsentType.MARKETING, "sign_up");
        }
        if (analytics) {
            grant(user, ConsentType.ANALYTICS, "sign_up");
        }
    }

    /**
     * Grant or withdraw one consent.
     *
     * @param user the consenting user
     * @param input consent type, desired state and optional withdrawal reason
     * @return the updated record
     * @throws IllegalStateException when withdrawing a consent that is not granted,
     *                               or a required consent on an active account
     */
    @Transactional
    public ConsentRecord updateConsent(UserProfile user, UpdateConsentInput input) {
        if (input.isGranted()) {
            ConsentRecord record = grant(user, input.getConsentType(), null);
            syncProfileFlags(user, input.getConsentType(), true);
            return record;
        }

        ConsentRecord record = consentRecordRepository
                .findByUserIdAndConsentType(user.getId(), input.getConsentType())
                .orElseThrow(() -> new IllegalStateException("Only granted consent can be withdrawn"));

        if (record.getStatus() != ConsentStatus.GRANTED) {
            throw new IllegalStateException("Only granted consent can be withdrawn");
        }
        if (input.getConsentType().isRequired() && user.getStatus() == UserStatus.ACTIVE) {
            throw new IllegalStateException(
                    "Required consent cannot be withdrawn while the account is active. Request account deletion instead.");
        }

        ConsentStatus previous = record.getStatus();
        record.withdraw(input.getReason(), now());
        ConsentRecord saved = consentRecordRepository.save(record);
        consentAuditLogRepository.save(new ConsentAuditLog(saved, "withdrawn", previous, input.getReason()));
        syncProfileFlags(user, input.getConsentType(), false);

        log.info("Consent {} withdrawn by user {}", input.getConsentType(), user.getId());
        return saved;
    }

    private ConsentRecord grant(UserProfile user, ConsentType type, String reason) {
        ConsentRecord record = consentRecordRepository.findByUserIdAndConsentType(user.getId(), type)
                .orElseGet(() -> new ConsentRecord(user.getId(), type, type.getPurpose(), appSettings.getConsentVersion()));

        ConsentStatus previous = record.getStatus();
        LocalDateTime now = now();
        record.grant(appSettings.getConsentVersion(), now, now.plusMonths(CONSENT_VALIDITY_MONTHS));
        ConsentRecord saved = consentRecordRepository.save(record);
        consentAuditLogRepository.save(new ConsentAuditLog(saved, "granted", previous, reason));

        log.info("Consent {} granted by user {} (version {})", type, user.getId(), appSettings.getConsentVersion());
        return saved;
    }

    /**
     * Mirror the consent onto the profile flags and persist the profile.
     * The profile usually arrives detached from an earlier transaction.
     */
    private void syncProfileFlags(UserProfile user, ConsentType type, boolean granted) {
        switch (type) {
            case PRIVACY_POLICY:
                user.setPrivacyPolicyAccepted(granted);
                break;
            case TERMS_OF_SERVICE:
                user.setTermsOfServiceAccepted(granted);
                break;
            case MARKETING:
                user.setMarketingConsent(granted);
                break;
            case ANALYTICS:
                user.setAnalyticsConsent(granted);
                break;
            default:
                return;
        }
        user.setConsentVersion(appSettings.getConsentVersion());
        userProfileRepository.save(user);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(ZoneOffset.UTC);
    }
}
