package app.listify.assets.domain.type;

public enum AssetFormat {
    model,
    video,
    ar
}
