package com.asiainfo.errortracking.domain.model;

/**
 * 租户，执行器据此为事件表加上 team_id 过滤
 */
public record Team(long id) {
}
