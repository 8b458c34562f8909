package org.pacificobservatory.newsdb.model;

/** One item found on a listing page: the article URL and whatever the listing showed about it */
public record ItemReference(String url, RawRecord fields) {}
