package org.example.lingua.service;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Counts consecutive days of learning activity ending today or yesterday.
 */
@Component
public class StreakCalculator {

    /**
     * @param activityDates activity days, most recent first; duplicates are allowed
     * @param today the current UTC day
     */
    public int calculateStreak(List<LocalDate> activityDates, LocalDate today) {
        if (activityDates == null || activityDates.isEmpty()) {
            return 0;
        }

        LocalDate mostRecent = activityDates.get(0);
        if (!mostRecent.equals(today) && !mostRecent.equals(today.minusDays(1))) {
            return 0;
        }

        int streak = 1;
        LocalDate previous = mostRecent;
        for (int i = 1; i < activityDates.size(); i++) {
            LocalDate current = activityDates.get(i);
            if (current.equals(previous)) {
                continue;
            }
            if (current.equals(previous.minusDays(1))) {
                streak++;
                previous = current;
            } else {
                break;
            }
        }
        return streak;
    }
}
