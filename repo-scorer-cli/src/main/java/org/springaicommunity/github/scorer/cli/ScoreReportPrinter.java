package org.springaicommunity.github.scorer.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springaicommunity.github.scorer.ObjectMapperFactory;
import org.springaicommunity.github.scorer.ScoreResult;

import java.util.Locale;

/**
 * Renders a {@link ScoreResult} for the console, either as the human-readable report or
 * as snake_case JSON. Rates are shown with two decimals. A partial result from an
 * interrupted run gets an extra line naming how many users the rates cover.
 */
public class ScoreReportPrinter {

	private final String organizationLabel;

	private final ObjectMapper reportMapper;

	public ScoreReportPrinter(String organizationLabel) {
		this.organizationLabel = organizationLabel;
		this.reportMapper = ObjectMapperFactory.createForReports();
	}

	public String format(ScoreResult result) {
		StringBuilder report = new StringBuilder();
		report.append("Repository: ").append(result.repository()).append('\n');
		report.append("Stars: ")
			.append(result.starCount())
			.append(", Watches: ")
			.append(result.watcherCount())
			.append(", Forks: ")
			.append(result.forkCount())
			.append('\n');
		report.append("Total unique users (starred, watched, forked): ").append(result.totalEngaged()).append('\n');
		report.append("Number of unique significant users: ").append(result.significantCount()).append('\n');
		report.append("Number of unique ")
			.append(organizationLabel)
			.append(" users: ")
			.append(result.orgCount())
			.append('\n');
		report.append("Power users rate: ").append(formatRate(result.powerUserRate())).append('\n');
		report.append(organizationLabel).append(" users rate: ").append(formatRate(result.orgUserRate())).append('\n');
		if (!result.isComplete()) {
			report.append("Partial result: rates cover ")
				.append(result.classifiedCount())
				.append(" of ")
				.append(result.totalEngaged())
				.append(" users\n");
		}
		return report.toString();
	}

	public String formatJson(ScoreResult result) {
		try {
			return reportMapper.writeValueAsString(result);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render score for " + result.repository() + " as JSON", e);
		}
	}

	static String formatRate(double rate) {
		return String.format(Locale.ROOT, "%.2f", rate);
	}

}
