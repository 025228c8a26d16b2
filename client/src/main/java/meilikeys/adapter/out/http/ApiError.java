package meilikeys.adapter.out.http;

/**
 * Error body returned by the server alongside a 4xx or 5xx status.
 *
 * @param message human-readable description
 * @param code    machine-readable code, e.g. {@code invalid_api_key_actions}
 * @param type    category, e.g. {@code invalid_request}
 * @param link    documentation link
 */
record ApiError(String message, String code, String type, String link) {}
