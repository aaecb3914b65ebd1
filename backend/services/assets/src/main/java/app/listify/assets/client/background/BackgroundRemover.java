package app.listify.assets.client.background;

public interface BackgroundRemover {

    /**
     * Returns the image with its background made transparent, encoded as PNG.
     */
    byte[] removeBackground(byte[] imageBytes);
}
