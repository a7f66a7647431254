package io.github.samzhu.tokenmeter.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.document.Team;
import io.github.samzhu.tokenmeter.document.TokenUsageEvent;
import io.github.samzhu.tokenmeter.dto.api.DailyTotal;
import io.github.samzhu.tokenmeter.dto.api.TeamUsage;
import io.github.samzhu.tokenmeter.dto.api.UsageHistoryResponse.DailyFeatureUsage;
import io.github.samzhu.tokenmeter.dto.api.UserUsage;
import io.github.samzhu.tokenmeter.util.PeriodUtils;

/**
 * 用量事件的彙總計算。
 *
 * <p>所有方法都是純函式：輸入已查出的事件，輸出彙總結果，不存取資料庫。
 * 日期一律以事件 {@code createdAt} 的 UTC 日期分組。
 */
@Service
public class UsageAggregationService {

    private final String defaultModel;

    public UsageAggregationService(MeteringProperties properties) {
        this.defaultModel = properties.estimation().defaultModel();
    }

    public long totalTokens(Collection<TokenUsageEvent> events) {
        return events.stream().mapToLong(TokenUsageEvent::tokensUsed).sum();
    }

    public long uniqueUsers(Collection<TokenUsageEvent> events) {
        return events.stream().map(TokenUsageEvent::userId).distinct().count();
    }

    /**
     * 每日 Token 總量，依日期升冪排列。
     *
     * @return 日期 (YYYY-MM-DD) → Token
     */
    public Map<String, Long> dailyTotals(Collection<TokenUsageEvent> events) {
        Map<String, Long> daily = new TreeMap<>();
        for (TokenUsageEvent event : events) {
            daily.merge(dateKey(event), event.tokensUsed(), Long::sum);
        }
        return daily;
    }

    /**
     * 每日 Token 總量與功能拆分。
     */
    public Map<String, DailyFeatureUsage> dailyFeatureUsage(Collection<TokenUsageEvent> events) {
        Map<String, Map<String, Long>> features = new TreeMap<>();
        for (TokenUsageEvent event : events) {
            features.computeIfAbsent(dateKey(event), k -> new LinkedHashMap<>())
                .merge(featureKey(event), event.tokensUsed(), Long::sum);
        }
        Map<String, DailyFeatureUsage> daily = new LinkedHashMap<>();
        features.forEach((date, byFeature) -> daily.put(date, new DailyFeatureUsage(
            byFeature.values().stream().mapToLong(Long::longValue).sum(), byFeature)));
        return daily;
    }

    public Map<String, Long> byFeature(Collection<TokenUsageEvent> events) {
        Map<String, Long> result = new LinkedHashMap<>();
        for (TokenUsageEvent event : events) {
            result.merge(featureKey(event), event.tokensUsed(), Long::sum);
        }
        return result;
    }

    /**
     * 依模型彙總，沒有模型的事件歸入預設模型。
     */
    public Map<String, Long> byModel(Collection<TokenUsageEvent> events) {
        Map<String, Long> result = new LinkedHashMap<>();
        for (TokenUsageEvent event : events) {
            String model = event.modelUsed() == null || event.modelUsed().isBlank()
                ? defaultModel
                : event.modelUsed();
            result.merge(model, event.tokensUsed(), Long::sum);
        }
        return result;
    }

    /**
     * 團隊用量，依 Token 降冪排列。沒有事件的團隊仍列出（Token 為 0）。
     */
    public List<TeamUsage> byTeam(Collection<TokenUsageEvent> events, Collection<Team> teams) {
        Map<String, long[]> totals = new HashMap<>();
        Map<String, Set<String>> users = new HashMap<>();
        for (TokenUsageEvent event : events) {
            if (event.teamId() == null) {
                continue;
            }
            long[] acc = totals.computeIfAbsent(event.teamId(), k -> new long[2]);
            acc[0] += event.tokensUsed();
            acc[1]++;
            users.computeIfAbsent(event.teamId(), k -> new HashSet<>()).add(event.userId());
        }

        List<TeamUsage> result = new ArrayList<>();
        for (Team team : teams) {
            long[] acc = totals.getOrDefault(team.id(), new long[2]);
            double percent = team.tokenLimit() > 0 ? (double) acc[0] / team.tokenLimit() * 100.0 : 0.0;
            result.add(new TeamUsage(
                team.id(),
                team.name(),
                acc[0],
                team.tokenLimit(),
                percent,
                users.getOrDefault(team.id(), Set.of()).size(),
                acc[1]));
        }
        result.sort((a, b) -> Long.compare(b.tokensUsed(), a.tokensUsed()));
        return result;
    }

    /**
     * 各用戶的 Token 與請求數。
     */
    public Map<String, UserUsage> byUser(Collection<TokenUsageEvent> events) {
        Map<String, UserUsage> result = new LinkedHashMap<>();
        for (TokenUsageEvent event : events) {
            result.compute(event.userId(), (userId, existing) -> existing == null
                ? new UserUsage(userId, event.tokensUsed(), 1)
                : new UserUsage(userId, existing.tokensUsed() + event.tokensUsed(), existing.requests() + 1));
        }
        return result;
    }

    /**
     * Token 用量前 N 名的用戶。
     */
    public List<UserUsage> topUsers(Collection<TokenUsageEvent> events, int limit) {
        return byUser(events).values().stream()
            .sorted((a, b) -> Long.compare(b.tokensUsed(), a.tokensUsed()))
            .limit(limit)
            .toList();
    }

    /**
     * 截至 {@code today}（含）的 N 日趨勢，沒有用量的日期補 0。
     *
     * @param dailyTotals {@link #dailyTotals} 的結果
     * @param today 最後一天 (UTC)
     * @param days 天數
     * @return 依日期升冪的每日總量
     */
    public List<DailyTotal> trend(Map<String, Long> dailyTotals, LocalDate today, int days) {
        List<DailyTotal> trend = new ArrayList<>(days);
        for (int i = days - 1; i >= 0; i--) {
            LocalDate date = today.minusDays(i);
            trend.add(new DailyTotal(date, dailyTotals.getOrDefault(date.toString(), 0L)));
        }
        return trend;
    }

    private static String dateKey(TokenUsageEvent event) {
        return PeriodUtils.toUtcDate(event.createdAt()).toString();
    }

    private static String featureKey(TokenUsageEvent event) {
        return event.featureUsed() == null ? "unknown" : event.featureUsed();
    }
}
