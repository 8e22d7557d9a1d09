package org.broadinstitute.signatures.utils.io;

import htsjdk.samtools.util.BlockCompressedInputStream;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.utils.Utils;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

public final class IOUtils {

    private IOUtils() { }

    /**
     * Makes a reader for a file, unzipping if the file's name ends with '.gz'.
     */
    public static Reader makeReaderMaybeGzipped(final Path path) throws IOException {
        final InputStream in = new BufferedInputStream(Files.newInputStream(path));
        // toString because path.endsWith only checks whole path components, not substrings.
        return makeReaderMaybeGzipped(in, path.toString().endsWith(".gz"));
    }

    /**
     * makes a reader for an inputStream wrapping it in an appropriate unzipper if necessary
     * @param zipped is this stream zipped
     */
    public static Reader makeReaderMaybeGzipped(final InputStream in, final boolean zipped) throws IOException {
        if (zipped) {
            return new InputStreamReader(makeZippedInputStream(in), StandardCharsets.UTF_8);
        } else {
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        }
    }

    /**
     * creates an input stream from a zipped stream
     * @return tries to create a block gzipped input stream and if it's not block gzipped it produces to a gzipped stream instead
     */
    public static InputStream makeZippedInputStream(final InputStream in) throws IOException {
        Utils.nonNull(in);
        if (BlockCompressedInputStream.isValidFile(in)) {
            return new BlockCompressedInputStream(in);
        } else {
            return new GZIPInputStream(in);
        }
    }

    /**
     * @param path Path to test
     * @throws UserException.CouldNotReadInputFile if the file isn't readable and a regular file
     */
    public static void assertFileIsReadable(final Path path) {
        Utils.nonNull(path);
        if ( ! Files.exists(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It doesn't exist.");
        }
        if ( ! Files.isRegularFile(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It isn't a regular file");
        }
        if ( ! Files.isReadable(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It is not readable, check the file permissions");
        }
    }
}
