package it.aw.editalanalysis.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Decodifica byte in testo provando una lista ordinata di encoding.
 * <p>
 * Ordine: UTF-8 con BOM, UTF-8, Latin-1, CP1252, ISO-8859-1. Vince il primo candidato
 * che decodifica senza errori e produce testo non vuoto (non solo spazi).
 * Latin-1 non fallisce mai sui byte: i candidati successivi entrano in gioco solo
 * quando il testo decodificato è vuoto.
 * <p>
 * Non lancia mai eccezioni: l'assenza di risultato è {@link Optional#empty()}.
 */
public class EncodingDecoder {

    private static final Logger log = LoggerFactory.getLogger(EncodingDecoder.class);

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    /** Una strategia di decodifica: nome leggibile + funzione che può fallire. */
    private record Candidate(String name, Charset charset, boolean requireBom) {}

    private static final List<Candidate> CANDIDATES = List.of(
            new Candidate("utf-8-sig",  StandardCharsets.UTF_8,      true),
            new Candidate("utf-8",      StandardCharsets.UTF_8,      false),
            new Candidate("latin-1",    StandardCharsets.ISO_8859_1, false),
            new Candidate("cp1252",     Charset.forName("windows-1252"), false),
            new Candidate("iso-8859-1", StandardCharsets.ISO_8859_1, false)
    );

    /**
     * Restituisce il testo decodificato con il primo encoding valido.
     *
     * @param bytes contenuto grezzo del file (null è trattato come vuoto)
     * @return testo decodificato, oppure vuoto se nessun candidato produce testo
     */
    public Optional<String> decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return Optional.empty();
        }
        for (Candidate candidate : CANDIDATES) {
            Optional<String> text = tryDecode(bytes, candidate);
            if (text.isPresent() && !text.get().isBlank()) {
                log.debug("Decodifica riuscita con encoding {} ({} caratteri)", candidate.name(), text.get().length());
                return text;
            }
        }
        log.debug("Nessun encoding ha prodotto testo ({} byte)", bytes.length);
        return Optional.empty();
    }

    private Optional<String> tryDecode(byte[] bytes, Candidate candidate) {
        byte[] payload = bytes;
        if (candidate.requireBom()) {
            if (!startsWithBom(bytes)) return Optional.empty();
            payload = Arrays.copyOfRange(bytes, UTF8_BOM.length, bytes.length);
        }
        CharsetDecoder decoder = candidate.charset().newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = decoder.decode(ByteBuffer.wrap(payload));
            return Optional.of(chars.toString());
        } catch (CharacterCodingException e) {
            log.trace("Encoding {} non applicabile: {}", candidate.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean startsWithBom(byte[] bytes) {
        if (bytes.length < UTF8_BOM.length) return false;
        for (int i = 0; i < UTF8_BOM.length; i++) {
            if (bytes[i] != UTF8_BOM[i]) return false;
        }
        return true;
    }
}
