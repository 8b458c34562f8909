package org.pacificobservatory.newsdb.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** Utility class for URL handling */
public class UrlUtils {

	/**
	 * Canonical form of an article URL, used as its external id. Scheme and host are lower-cased,
	 * default ports, fragments and trailing slashes are removed; the query is kept as is.
	 *
	 * @param url absolute http(s) URL
	 * @return the canonical URL, or {@code null} if the URL is not an absolute http(s) URL
	 */
	public static String canonicalize(String url) {
		URI uri = parse(url);
		if (uri == null) {
			return null;
		}
		String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
		String host = uri.getHost().toLowerCase(Locale.ROOT);
		int port = uri.getPort();
		if ((port == 80 && scheme.equals("http")) || (port == 443 && scheme.equals("https"))) {
			port = -1;
		}
		String path = uri.getRawPath() == null ? "" : uri.getRawPath();
		while (path.endsWith("/")) {
			path = path.substring(0, path.length() - 1);
		}
		StringBuilder sb = new StringBuilder();
		sb.append(scheme).append("://").append(host);
		if (port != -1) {
			sb.append(':').append(port);
		}
		sb.append(path);
		if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
			sb.append('?').append(uri.getRawQuery());
		}
		return sb.toString();
	}

	/** Check that the value is an absolute http or https URL with a host */
	public static boolean isHttpUrl(String url) {
		return parse(url) != null;
	}

	/**
	 * Resolve a possibly relative link against the page it was found on.
	 *
	 * @return the absolute URL, or {@code null} if either part cannot be parsed
	 */
	public static String resolve(String base, String href) {
		if (href == null || href.isBlank()) {
			return null;
		}
		try {
			URI ref = new URI(encodeSpaces(href.trim()));
			if (ref.isAbsolute() || base == null) {
				return ref.toString();
			}
			return new URI(encodeSpaces(base.trim())).resolve(ref).toString();
		} catch (URISyntaxException | IllegalArgumentException e) {
			return null;
		}
	}

	/** Host name of the URL, lower-cased, or {@code null} */
	public static String host(String url) {
		URI uri = parse(url);
		return uri == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
	}

	private static URI parse(String url) {
		if (url == null || url.isBlank()) {
			return null;
		}
		try {
			URI uri = new URI(encodeSpaces(url.trim()));
			String scheme = uri.getScheme();
			if (scheme == null || uri.getHost() == null) {
				return null;
			}
			if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) {
				return null;
			}
			return uri;
		} catch (URISyntaxException e) {
			return null;
		}
	}

	private static String encodeSpaces(String url) {
		return url.replace(" ", "%20");
	}
}
