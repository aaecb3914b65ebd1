package app.listify.assets.support.mesh;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the triangle geometry of a binary glTF 2.0 (GLB) file into world space.
 * Node transforms are applied; each triangle takes the material base color, multiplied by
 * the base color texture sampled at the triangle centroid when one is embedded.
 */
public final class GlbModelReader {

    private static final int MAGIC = 0x46546C67;
    private static final int CHUNK_JSON = 0x4E4F534A;
    private static final int CHUNK_BIN = 0x004E4942;
    private static final int MODE_TRIANGLES = 4;
    private static final int COMPONENT_UNSIGNED_BYTE = 5121;
    private static final int COMPONENT_UNSIGNED_SHORT = 5123;
    private static final int COMPONENT_UNSIGNED_INT = 5125;
    private static final int COMPONENT_FLOAT = 5126;
    private static final int DEFAULT_COLOR = 0xFFB4B4B4;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GlbModelReader() {
    }

    public static MeshModel read(Path path) throws IOException {
        return parse(Files.readAllBytes(path));
    }

    public static MeshModel parse(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length < 20) {
            throw new IOException("GLB file is truncated");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        if (buffer.getInt(0) != MAGIC) {
            throw new IOException("Not a GLB file");
        }
        int version = buffer.getInt(4);
        if (version != 2) {
            throw new IOException("Unsupported GLB version " + version);
        }
        int length = Math.min(buffer.getInt(8), bytes.length);
        JsonNode gltf = null;
        ByteBuffer bin = null;
        int offset = 12;
        while (offset + 8 <= length) {
            int chunkLength = buffer.getInt(offset);
            int chunkType = buffer.getInt(offset + 4);
            int start = offset + 8;
            if (chunkLength < 0 || start + chunkLength > length) {
                throw new IOException("GLB chunk exceeds file length");
            }
            if (chunkType == CHUNK_JSON) {
                gltf = MAPPER.readTree(bytes, start, chunkLength);
            } else if (chunkType == CHUNK_BIN && bin == null) {
                bin = ByteBuffer.wrap(bytes, start, chunkLength).slice().order(ByteOrder.LITTLE_ENDIAN);
            }
            offset = start + chunkLength;
        }
        if (gltf == null) {
            throw new IOException("GLB has no JSON chunk");
        }
        return new Assembler(gltf, bin).assemble();
    }

    private static final class Assembler {
        private final JsonNode gltf;
        private final ByteBuffer bin;
        private final Map<Integer, BufferedImage> images = new HashMap<>();
        private final List<float[]> positionParts = new ArrayList<>();
        private final List<int[]> indexParts = new ArrayList<>();
        private final List<int[]> colorParts = new ArrayList<>();
        private int vertexOffset;

        private Assembler(JsonNode gltf, ByteBuffer bin) {
            this.gltf = gltf;
            this.bin = bin;
        }

        private MeshModel assemble() throws IOException {
            JsonNode scenes = gltf.path("scenes");
            if (scenes.isArray() && !scenes.isEmpty()) {
                JsonNode scene = scenes.path(gltf.path("scene").asInt(0));
                for (JsonNode nodeIndex : scene.path("nodes")) {
                    visitNode(nodeIndex.asInt(), Matrices.identity(), 0);
                }
            } else {
                JsonNode meshes = gltf.path("meshes");
                for (int i = 0; i < meshes.size(); i++) {
                    addMesh(i, Matrices.identity());
                }
            }
            return concatenate();
        }

        private void visitNode(int index, double[] parent, int depth) throws IOException {
            if (depth > 64) {
                throw new IOException("GLB node hierarchy is too deep");
            }
            JsonNode node = gltf.path("nodes").path(index);
            if (node.isMissingNode()) {
                throw new IOException("GLB references missing node " + index);
            }
            double[] world = Matrices.multiply(parent, Matrices.local(node));
            if (node.has("mesh")) {
                addMesh(node.get("mesh").asInt(), world);
            }
            for (JsonNode child : node.path("children")) {
                visitNode(child.asInt(), world, depth + 1);
            }
        }

        private void addMesh(int meshIndex, double[] transform) throws IOException {
            JsonNode mesh = gltf.path("meshes").path(meshIndex);
            for (JsonNode primitive : mesh.path("primitives")) {
                if (primitive.path("mode").asInt(MODE_TRIANGLES) != MODE_TRIANGLES) {
                    continue;
                }
                JsonNode attributes = primitive.path("attributes");
                if (!attributes.has("POSITION")) {
                    continue;
                }
                float[] local = readFloats(attributes.get("POSITION").asInt(), 3);
                int vertexCount = local.length / 3;
                float[] world = new float[local.length];
                for (int v = 0; v < vertexCount; v++) {
                    Matrices.transformPoint(transform, local, v * 3, world);
                }
                int[] indices = primitive.has("indices")
                        ? readIndices(primitive.get("indices").asInt())
                        : sequence(vertexCount);
                int triangleCount = indices.length / 3;
                for (int index : indices) {
                    if (index < 0 || index >= vertexCount) {
                        throw new IOException("GLB index out of range: " + index);
                    }
                }
                float[] uvs = attributes.has("TEXCOORD_0") ? readUvs(attributes.get("TEXCOORD_0").asInt()) : null;
                if (uvs != null && uvs.length / 2 < vertexCount) {
                    uvs = null;
                }
                int[] colors = triangleColors(primitive, indices, triangleCount, uvs);

                int[] shifted = new int[triangleCount * 3];
                for (int i = 0; i < shifted.length; i++) {
                    shifted[i] = indices[i] + vertexOffset;
                }
                positionParts.add(world);
                indexParts.add(shifted);
                colorParts.add(colors);
                vertexOffset += vertexCount;
            }
        }

        private int[] triangleColors(JsonNode primitive, int[] indices, int triangleCount, float[] uvs) throws IOException {
            int[] colors = new int[triangleCount];
            double[] factor = {1, 1, 1, 1};
            BufferedImage texture = null;
            if (primitive.has("material")) {
                JsonNode pbr = gltf.path("materials").path(primitive.get("material").asInt()).path("pbrMetallicRoughness");
                JsonNode baseColor = pbr.path("baseColorFactor");
                if (baseColor.isArray() && baseColor.size() >= 3) {
                    for (int i = 0; i < Math.min(4, baseColor.size()); i++) {
                        factor[i] = baseColor.get(i).asDouble(1);
                    }
                }
                if (pbr.has("baseColorTexture") && uvs != null) {
                    texture = texture(pbr.path("baseColorTexture").path("index").asInt(-1));
                }
            }
            boolean plain = texture == null && !primitive.has("material");
            for (int t = 0; t < triangleCount; t++) {
                if (plain) {
                    colors[t] = DEFAULT_COLOR;
                    continue;
                }
                double r = factor[0];
                double g = factor[1];
                double b = factor[2];
                if (texture != null) {
                    double u = (uvs[indices[t * 3] * 2] + uvs[indices[t * 3 + 1] * 2] + uvs[indices[t * 3 + 2] * 2]) / 3.0;
                    double v = (uvs[indices[t * 3] * 2 + 1] + uvs[indices[t * 3 + 1] * 2 + 1] + uvs[indices[t * 3 + 2] * 2 + 1]) / 3.0;
                    int texel = sample(texture, u, v);
                    r *= ((texel >> 16) & 0xFF) / 255.0;
                    g *= ((texel >> 8) & 0xFF) / 255.0;
                    b *= (texel & 0xFF) / 255.0;
                }
                colors[t] = 0xFF000000 | (channel(r) << 16) | (channel(g) << 8) | channel(b);
            }
            return colors;
        }

        private BufferedImage texture(int textureIndex) throws IOException {
            if (textureIndex < 0) {
                return null;
            }
            int source = gltf.path("textures").path(textureIndex).path("source").asInt(-1);
            if (source < 0) {
                return null;
            }
            if (images.containsKey(source)) {
                return images.get(source);
            }
            JsonNode image = gltf.path("images").path(source);
            BufferedImage decoded = null;
            if (image.has("bufferView") && bin != null) {
                JsonNode view = bufferView(image.get("bufferView").asInt());
                int start = view.path("byteOffset").asInt(0);
                int length = view.path("byteLength").asInt(0);
                checkRange(start, length);
                byte[] data = new byte[length];
                bin.get(start, data);
                decoded = ImageIO.read(new ByteArrayInputStream(data));
            }
            images.put(source, decoded);
            return decoded;
        }

        private float[] readUvs(int accessorIndex) throws IOException {
            JsonNode accessor = accessor(accessorIndex);
            if (accessor.path("componentType").asInt() != COMPONENT_FLOAT) {
                return null;
            }
            return readFloats(accessorIndex, 2);
        }

        private float[] readFloats(int accessorIndex, int components) throws IOException {
            JsonNode accessor = accessor(accessorIndex);
            int count = accessor.path("count").asInt(0);
            float[] values = new float[count * components];
            if (!accessor.has("bufferView")) {
                return values;
            }
            if (accessor.path("componentType").asInt() != COMPONENT_FLOAT) {
                throw new IOException("Unsupported component type for accessor " + accessorIndex);
            }
            JsonNode view = bufferView(accessor.get("bufferView").asInt());
            int elementSize = components * 4;
            int stride = view.path("byteStride").asInt(elementSize);
            int base = view.path("byteOffset").asInt(0) + accessor.path("byteOffset").asInt(0);
            if (count > 0) {
                checkRange(base, (count - 1) * stride + elementSize);
            }
            for (int i = 0; i < count; i++) {
                int position = base + i * stride;
                for (int c = 0; c < components; c++) {
                    values[i * components + c] = bin.getFloat(position + c * 4);
                }
            }
            return values;
        }

        private int[] readIndices(int accessorIndex) throws IOException {
            JsonNode accessor = accessor(accessorIndex);
            int count = accessor.path("count").asInt(0);
            int componentType = accessor.path("componentType").asInt();
            int size = switch (componentType) {
                case COMPONENT_UNSIGNED_BYTE -> 1;
                case COMPONENT_UNSIGNED_SHORT -> 2;
                case COMPONENT_UNSIGNED_INT -> 4;
                default -> throw new IOException("Unsupported index component type " + componentType);
            };
            int[] indices = new int[count - count % 3];
            if (!accessor.has("bufferView")) {
                return indices;
            }
            JsonNode view = bufferView(accessor.get("bufferView").asInt());
            int stride = view.path("byteStride").asInt(size);
            int base = view.path("byteOffset").asInt(0) + accessor.path("byteOffset").asInt(0);
            if (count > 0) {
                checkRange(base, (count - 1) * stride + size);
            }
            for (int i = 0; i < indices.length; i++) {
                int position = base + i * stride;
                indices[i] = switch (size) {
                    case 1 -> bin.get(position) & 0xFF;
                    case 2 -> bin.getShort(position) & 0xFFFF;
                    default -> bin.getInt(position);
                };
            }
            return indices;
        }

        private JsonNode accessor(int index) throws IOException {
            JsonNode accessor = gltf.path("accessors").path(index);
            if (accessor.isMissingNode()) {
                throw new IOException("GLB references missing accessor " + index);
            }
            return accessor;
        }

        private JsonNode bufferView(int index) throws IOException {
            JsonNode view = gltf.path("bufferViews").path(index);
            if (view.isMissingNode()) {
                throw new IOException("GLB references missing buffer view " + index);
            }
            if (view.path("buffer").asInt(0) != 0) {
                throw new IOException("External GLB buffers are not supported");
            }
            return view;
        }

        private void checkRange(int start, int length) throws IOException {
            if (bin == null) {
                throw new IOException("GLB has no binary chunk");
            }
            if (start < 0 || length < 0 || start + length > bin.limit()) {
                throw new IOException("GLB buffer view exceeds binary chunk");
            }
        }

        private MeshModel concatenate() {
            int positionCount = positionParts.stream().mapToInt(part -> part.length).sum();
            int indexCount = indexParts.stream().mapToInt(part -> part.length).sum();
            float[] positions = new float[positionCount];
            int[] indices = new int[indexCount];
            int[] colors = new int[indexCount / 3];
            int p = 0;
            int i = 0;
            int c = 0;
            for (int part = 0; part < positionParts.size(); part++) {
                float[] partPositions = positionParts.get(part);
                System.arraycopy(partPositions, 0, positions, p, partPositions.length);
                p += partPositions.length;
                int[] partIndices = indexParts.get(part);
                System.arraycopy(partIndices, 0, indices, i, partIndices.length);
                i += partIndices.length;
                int[] partColors = colorParts.get(part);
                System.arraycopy(partColors, 0, colors, c, partColors.length);
                c += partColors.length;
            }
            return new MeshModel(positions, indices, colors);
        }

        private static int[] sequence(int count) {
            int[] indices = new int[count - count % 3];
            for (int i = 0; i < indices.length; i++) {
                indices[i] = i;
            }
            return indices;
        }

        private static int sample(BufferedImage texture, double u, double v) {
            int x = Math.floorMod((int) Math.floor(u * texture.getWidth()), texture.getWidth());
            int y = Math.floorMod((int) Math.floor(v * texture.getHeight()), texture.getHeight());
            return texture.getRGB(x, y);
        }

        private static int channel(double value) {
            return (int) Math.round(Math.max(0, Math.min(1, value)) * 255);
        }
    }

    /**
     * Column-major 4x4 matrices as used by glTF.
     */
    private static final class Matrices {

        private Matrices() {
        }

        static double[] identity() {
            return new double[]{
                    1, 0, 0, 0,
                    0, 1, 0, 0,
                    0, 0, 1, 0,
                    0, 0, 0, 1
            };
        }

        static double[] local(JsonNode node) {
            JsonNode matrix = node.path("matrix");
            if (matrix.isArray() && matrix.size() == 16) {
                double[] m = new double[16];
                for (int i = 0; i < 16; i++) {
                    m[i] = matrix.get(i).asDouble();
                }
                return m;
            }
            double[] t = vector(node.path("translation"), new double[]{0, 0, 0});
            double[] q = vector(node.path("rotation"), new double[]{0, 0, 0, 1});
            double[] s = vector(node.path("scale"), new double[]{1, 1, 1});
            double x = q[0];
            double y = q[1];
            double z = q[2];
            double w = q[3];
            return new double[]{
                    (1 - 2 * (y * y + z * z)) * s[0], (2 * (x * y + z * w)) * s[0], (2 * (x * z - y * w)) * s[0], 0,
                    (2 * (x * y - z * w)) * s[1], (1 - 2 * (x * x + z * z)) * s[1], (2 * (y * z + x * w)) * s[1], 0,
                    (2 * (x * z + y * w)) * s[2], (2 * (y * z - x * w)) * s[2], (1 - 2 * (x * x + y * y)) * s[2], 0,
                    t[0], t[1], t[2], 1
            };
        }

        static double[] multiply(double[] a, double[] b) {
            double[] r = new double[16];
            for (int col = 0; col < 4; col++) {
                for (int row = 0; row < 4; row++) {
                    double sum = 0;
                    for (int k = 0; k < 4; k++) {
                        sum += a[k * 4 + row] * b[col * 4 + k];
                    }
                    r[col * 4 + row] = sum;
                }
            }
            return r;
        }

        static void transformPoint(double[] m, float[] source, int offset, float[] target) {
            double x = source[offset];
            double y = source[offset + 1];
            double z = source[offset + 2];
            target[offset] = (float) (m[0] * x + m[4] * y + m[8] * z + m[12]);
            target[offset + 1] = (float) (m[1] * x + m[5] * y + m[9] * z + m[13]);
            target[offset + 2] = (float) (m[2] * x + m[6] * y + m[10] * z + m[14]);
        }

        private static double[] vector(JsonNode node, double[] fallback) {
            if (!node.isArray() || node.size() != fallback.length) {
                return fallback;
            }
            double[] values = new double[fallback.length];
            for (int i = 0; i < values.length; i++) {
                values[i] = node.get(i).asDouble();
            }
            return values;
        }
    }
}
