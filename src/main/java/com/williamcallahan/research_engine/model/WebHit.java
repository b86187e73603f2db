package com.williamcallahan.research_engine.model;

/**
 * Raw web-search result: title, url, cleaned snippet and host.
 */
public record WebHit(String title, String url, String snippet, String domain) {
}
