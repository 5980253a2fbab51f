package io.finetl.campaign;

import java.nio.charset.Charset;
import java.util.List;

/**
 * Outcome of probing the head of a file.
 *
 * @param charset    encoding every line of the file is decoded with
 * @param delimiter  field delimiter taken from the first line
 * @param lossy      true when undecodable bytes are replaced instead of reported
 * @param rejections why each earlier encoding in the chain was passed over, in chain order
 */
public record Detection(Charset charset, Delimiter delimiter, boolean lossy, List<String> rejections) {
    public Detection {
        rejections = List.copyOf(rejections);
    }
}
