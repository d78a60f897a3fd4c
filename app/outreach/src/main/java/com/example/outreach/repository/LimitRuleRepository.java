package com.example.outreach.repository;

import com.example.outreach.model.LimitRule;
import com.example.outreach.model.LimitRuleType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Read-only access to the seeded limit_rules table. */
@Repository
@RequiredArgsConstructor
public class LimitRuleRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Map<LimitRuleType, LimitRule> findAll() {
    final String sql =
        "SELECT rule_type, default_value, warmup_value, max_value FROM limit_rules";
    final List<LimitRule> rules =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource(),
            (rs, rowNum) ->
                new LimitRule(
                    LimitRuleType.fromValue(rs.getString("rule_type")),
                    rs.getInt("default_value"),
                    rs.getInt("warmup_value"),
                    rs.getInt("max_value")));
    final Map<LimitRuleType, LimitRule> byType = new EnumMap<>(LimitRuleType.class);
    for (LimitRule rule : rules) {
      byType.put(rule.ruleType(), rule);
    }
    return byType;
  }
}
