package com.growthpilot.platform.scheduler.service.tweet;

import com.growthpilot.platform.scheduler.config.SchedulerProperties;
import com.growthpilot.platform.scheduler.exception.ContentValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class TweetContentValidator {

    private final SchedulerProperties properties;

    public void validate(TweetClaim claim) {
        List<String> segments = claim.getSegments();
        if (segments.isEmpty()) {
            throw new ContentValidationException("Thread has no contents");
        }
        int maxLength = properties.getDispatch().getMaxContentLength();
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (segment == null || segment.isBlank()) {
                throw new ContentValidationException("Segment " + (i + 1) + " is empty");
            }
            if (segment.codePointCount(0, segment.length()) > maxLength) {
                throw new ContentValidationException(String.format(
                        "Segment %d exceeds %d characters", i + 1, maxLength));
            }
        }
    }
}
