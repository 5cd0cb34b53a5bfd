package exray.bridge.api;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.multipart.Attribute;
import io.netty.handler.codec.http.multipart.DefaultHttpDataFactory;
import io.netty.handler.codec.http.multipart.FileUpload;
import io.netty.handler.codec.http.multipart.HttpPostRequestDecoder;
import io.netty.handler.codec.http.multipart.InterfaceHttpData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A decoded form body. Uploaded files are copied to temporary files that are deleted on close.
 */
public final class MultipartForm implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MultipartForm.class);

    private final Map<String, String> fields = new LinkedHashMap<>();
    private final Map<String, UploadedPart> files = new LinkedHashMap<>();

    /**
     * A stored upload and the name the client sent with it.
     */
    public record UploadedPart(Path path, String filename) {
    }

    private MultipartForm() {
    }

    /**
     * @throws IllegalArgumentException if the body is not a form
     */
    public static MultipartForm decode(FullHttpRequest req) throws IOException {
        MultipartForm form = new MultipartForm();
        HttpPostRequestDecoder decoder;
        try {
            decoder = new HttpPostRequestDecoder(new DefaultHttpDataFactory(false), req);
        } catch (HttpPostRequestDecoder.ErrorDataDecoderException e) {
            throw new IllegalArgumentException("Malformed form body: " + e.getMessage(), e);
        }
        try {
            for (InterfaceHttpData data : decoder.getBodyHttpDatas()) {
                if (data.getHttpDataType() == InterfaceHttpData.HttpDataType.Attribute) {
                    Attribute attribute = (Attribute) data;
                    form.fields.put(attribute.getName(), attribute.getValue());
                } else if (data.getHttpDataType() == InterfaceHttpData.HttpDataType.FileUpload) {
                    FileUpload upload = (FileUpload) data;
                    if (!upload.isCompleted()) {
                        continue;
                    }
                    Path tmp = Files.createTempFile("exray-upload-", suffix(upload.getFilename()));
                    Files.write(tmp, upload.get());
                    form.files.put(upload.getName(), new UploadedPart(tmp, upload.getFilename()));
                }
            }
        } catch (HttpPostRequestDecoder.ErrorDataDecoderException e) {
            form.close();
            throw new IllegalArgumentException("Malformed form body: " + e.getMessage(), e);
        } catch (IOException e) {
            form.close();
            throw e;
        } finally {
            decoder.destroy();
        }
        return form;
    }

    public Map<String, String> fields() {
        return fields;
    }

    public Optional<UploadedPart> file(String name) {
        return Optional.ofNullable(files.get(name));
    }

    @Override
    public void close() {
        for (UploadedPart part : files.values()) {
            try {
                Files.deleteIfExists(part.path());
            } catch (IOException e) {
                log.warn("Failed to delete temporary upload {}: {}", part.path(), e.getMessage());
            }
        }
        files.clear();
    }

    private static String suffix(String filename) {
        if (filename == null) {
            return ".tmp";
        }
        int dot = filename.lastIndexOf('.');
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (dot <= slash + 1 || dot == filename.length() - 1) {
            return ".tmp";
        }
        String ext = filename.substring(dot);
        return ext.matches("\\.[A-Za-z0-9]{1,10}") ? ext : ".tmp";
    }
}
