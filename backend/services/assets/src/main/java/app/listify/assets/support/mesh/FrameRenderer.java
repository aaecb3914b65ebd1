package app.listify.assets.support.mesh;

import java.awt.image.BufferedImage;

public interface FrameRenderer {
    BufferedImage render(MeshModel model, Rotation rotation, int width, int height);
}
