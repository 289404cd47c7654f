package me.go_gradually.soundrelay.domain.relay;

public record BrowserCookie(String name,
                            String value,
                            String domain,
                            String path,
                            Long expires,
                            boolean httpOnly,
                            boolean secure,
                            String sameSite) {
    public BrowserCookie {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Cookie name is required");
        }
        value = value == null ? "" : value;
        path = path == null || path.isBlank() ? "/" : path;
    }

    public static BrowserCookie of(String name, String value, String domain) {
        return new BrowserCookie(name, value, domain, "/", null, false, false, null);
    }

    public String toHeaderPair() {
        return name + "=" + value;
    }
}
