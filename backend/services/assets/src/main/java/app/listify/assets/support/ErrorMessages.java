package app.listify.assets.support;

public final class ErrorMessages {

    private static final int MAX_LENGTH = 200;

    private ErrorMessages() {
    }

    public static String summarize(Throwable ex) {
        if (ex == null) {
            return "";
        }
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        return trimmed.length() <= MAX_LENGTH ? trimmed : trimmed.substring(0, MAX_LENGTH) + "...";
    }
}
