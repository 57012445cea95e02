package github.sarthakdev143.reel_forge.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConnectionStats(
        int subscribers,
        int watchedTasks,
        int taskSubscriptions,
        int watchedUsers,
        int userSubscriptions) {
}
