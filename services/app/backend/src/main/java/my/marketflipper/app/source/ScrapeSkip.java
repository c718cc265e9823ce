package my.marketflipper.app.source;

public record ScrapeSkip(int index, String reason) {
}
