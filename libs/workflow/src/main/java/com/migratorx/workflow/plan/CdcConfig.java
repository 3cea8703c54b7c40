package com.migratorx.workflow.plan;

/**
 * Change-data-capture settings of a plan.
 *
 * @param type      CDC technology (e.g. "debezium")
 * @param connector connector name used by the CDC health checks
 */
public record CdcConfig(String type, String connector) {}
