package com.growthpilot.platform.scheduler.service.tweet;

import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.entity.ScheduledTweet;
import com.growthpilot.platform.scheduler.entity.TweetStatus;
import com.growthpilot.platform.scheduler.exception.ContentValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TweetContentValidatorTest {

    private final TweetContentValidator validator = new TweetContentValidator(new SchedulerProperties());

    private static TweetClaim single(String content) {
        return TweetClaim.of(ScheduledTweet.builder().content(content).build(), TweetStatus.PENDING);
    }

    private static TweetClaim thread(List<String> parts) {
        return TweetClaim.of(ScheduledTweet.builder().thread(true).threadContents(new ArrayList<>(parts)).build(),
                TweetStatus.PENDING);
    }

    @Test
    void acceptsContentUpToTheLimit() {
        assertDoesNotThrow(() -> validator.validate(single("a".repeat(280))));
    }

    @Test
    void countsCodePointsNotChars() {
        // 280 emoji are 560 UTF-16 chars but 280 code points
        assertDoesNotThrow(() -> validator.validate(single("🚀".repeat(280))));
    }

    @Test
    void rejectsOverlongOrBlankContent() {
        assertThrows(ContentValidationException.class, () -> validator.validate(single("a".repeat(281))));
        assertThrows(ContentValidationException.class, () -> validator.validate(single("   ")));
        assertThrows(ContentValidationException.class, () -> validator.validate(single(null)));
    }

    @Test
    void rejectsEmptyThreadsAndBlankSegments() {
        assertThrows(ContentValidationException.class, () -> validator.validate(thread(List.of())));
        assertThrows(ContentValidationException.class, () -> validator.validate(thread(List.of("1/ ok", " "))));
    }
}
