package com.coparent.service;

import com.coparent.dto.FamilySettingsDto;
import com.coparent.dto.UserSettingsDto;
import com.coparent.entity.FamilySettings;
import com.coparent.entity.User;
import com.coparent.entity.UserSettings;
import com.coparent.exception.ValidationException;
import com.coparent.repository.FamilySettingsRepository;
import com.coparent.repository.UserSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class SettingsService {

    private final UserSettingsRepository userSettingsRepository;
    private final FamilySettingsRepository familySettingsRepository;
    private final FamilyAccessService familyAccessService;

    /**
     * Stored settings only; empty when the user never saved any.
     */
    @Transactional(readOnly = true)
    public Optional<UserSettingsDto> getUserSettings(User actor) {
        return userSettingsRepository.findById(actor.getId()).map(UserSettingsDto::from);
    }

    @Transactional(readOnly = true)
    public UserSettingsDto getAllUserSettings(User actor) {
        return UserSettingsDto.from(userSettingsRepository.findById(actor.getId())
                .orElseGet(() -> UserSettings.builder().userId(actor.getId()).build()));
    }

    @Transactional
    public UserSettingsDto updateUserSettings(User actor, UserSettingsDto update) {
        UserSettings settings = userSettingsRepository.findById(actor.getId())
                .orElseGet(() -> UserSettings.builder().userId(actor.getId()).build());

        if (update.getLanguage() != null) {
            settings.setLanguage(update.getLanguage());
        }
        if (update.getTimezone() != null) {
            settings.setTimezone(update.getTimezone());
        }
        if (update.getDateFormat() != null) {
            settings.setDateFormat(update.getDateFormat());
        }
        if (update.getTimeFormat() != null) {
            settings.setTimeFormat(update.getTimeFormat());
        }
        if (update.getWeekStart() != null) {
            settings.setWeekStart(update.getWeekStart());
        }
        if (update.getTheme() != null) {
            settings.setTheme(update.getTheme());
        }
        settings = userSettingsRepository.save(settings);
        log.info("Settings updated for user {}", actor.getId());
        return UserSettingsDto.from(settings);
    }

    @Transactional(readOnly = true)
    public Optional<FamilySettingsDto> getFamilySettings(Long familyId, User actor) {
        familyAccessService.requireMember(familyId, actor);
        return familySettingsRepository.findById(familyId).map(FamilySettingsDto::from);
    }

    @Transactional(readOnly = true)
    public FamilySettingsDto getAllFamilySettings(Long familyId, User actor) {
        familyAccessService.requireMember(familyId, actor);
        return FamilySettingsDto.from(familySettingsRepository.findById(familyId)
                .orElseGet(() -> FamilySettings.builder().familyId(familyId).build()));
    }

    /**
     * Partial update. The resulting parent percentages must add up to exactly 100.
     */
    @Transactional
    public FamilySettingsDto updateFamilySettings(Long familyId, User actor, FamilySettingsDto update) {
        familyAccessService.requireMember(familyId, actor);
        FamilySettings settings = familySettingsRepository.findById(familyId)
                .orElseGet(() -> FamilySettings.builder().familyId(familyId).build());

        int parent1 = percentage(update.getParent1Percentage(), settings.getParent1Percentage());
        int parent2 = percentage(update.getParent2Percentage(), settings.getParent2Percentage());
        if (parent1 + parent2 != 100) {
            throw new ValidationException("invalid-percentage-split",
                    "Parent percentages must add up to 100, got " + (parent1 + parent2));
        }
        settings.setParent1Percentage(parent1);
        settings.setParent2Percentage(parent2);

        if (update.getDefaultCurrency() != null) {
            settings.setDefaultCurrency(update.getDefaultCurrency());
        }
        if (update.getExpenseSplitDefault() != null) {
            settings.setExpenseSplitDefault(update.getExpenseSplitDefault());
        }
        if (update.getRequireApprovalForExpenses() != null) {
            settings.setRequireApprovalForExpenses(update.getRequireApprovalForExpenses());
        }
        if (update.getExpenseApprovalThreshold() != null) {
            settings.setExpenseApprovalThreshold(update.getExpenseApprovalThreshold());
        }
        if (update.getAllowSwapRequests() != null) {
            settings.setAllowSwapRequests(update.getAllowSwapRequests());
        }
        if (update.getRequireApprovalForSwaps() != null) {
            settings.setRequireApprovalForSwaps(update.getRequireApprovalForSwaps());
        }
        if (update.getReminderDefaultTime() != null) {
            settings.setReminderDefaultTime(update.getReminderDefaultTime());
        }
        if (update.getEnableCalendarReminders() != null) {
            settings.setEnableCalendarReminders(update.getEnableCalendarReminders());
        }
        if (update.getCalendarReminderMinutes() != null) {
            settings.setCalendarReminderMinutes(update.getCalendarReminderMinutes());
        }
        settings = familySettingsRepository.save(settings);
        log.info("Family {} settings updated by {}", familyId, actor.getId());
        return FamilySettingsDto.from(settings);
    }

    private static int percentage(Integer requested, Integer stored) {
        if (requested != null) {
            return requested;
        }
        return stored != null ? stored : FamilySettings.DEFAULT_PERCENTAGE;
    }
}
