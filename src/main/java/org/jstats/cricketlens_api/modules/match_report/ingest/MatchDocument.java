package org.jstats.cricketlens_api.modules.match_report.ingest;

/**
 * One match as handed to the retrieval side: the rendered report plus its metadata.
 */
public record MatchDocument(String text, MatchDocumentMetadata metadata) {}
