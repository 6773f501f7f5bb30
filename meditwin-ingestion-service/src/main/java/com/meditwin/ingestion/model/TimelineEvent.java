package com.meditwin.ingestion.model;

public record TimelineEvent(String date, String event, SourceRef source) {
}
