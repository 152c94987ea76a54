package lpp.chem;

import lpp.LppOptionException;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Resolves chemical names against a synonym table of the form
 *
 * <pre>
 * {
 *   "WATER": {"formula": "H2O", "cas": "7732-18-5"},
 *   ...
 * }
 * </pre>
 *
 * Names not in the table resolve as already canonical, so their text is kept. A table entry may map a name
 * to {@code "MISSING"} to reject it.
 */
public class JsonChemicalResolver implements ChemicalResolver {

	private static final Logger logger = Logger.getLogger(JsonChemicalResolver.class.getName());

	public static final String DEFAULT_TABLE = "/lpp/synonyms.json";

	private final Map<String, ChemicalResolution> synonyms;

	public JsonChemicalResolver(JSONObject table) throws LppOptionException {
		this.synonyms = new HashMap<>();
		try {
			for (String name : table.keySet()) {
				JSONObject entry = table.getJSONObject(name);
				String formula = entry.optString("formula", ChemicalResolution.NULL);
				String cas = entry.optString("cas", ChemicalResolution.NULL);
				synonyms.put(name.toUpperCase(Locale.ROOT), new ChemicalResolution(formula, cas));
			}
		} catch (JSONException e) {
			throw new LppOptionException("Malformed chemical synonym table: " + e.getMessage(), e);
		}
	}

	public static JsonChemicalResolver fromFile(Path path) throws LppOptionException {
		try {
			return new JsonChemicalResolver(new JSONObject(FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8)));
		} catch (IOException e) {
			throw new LppOptionException("Cannot read chemical synonym table " + path, e);
		} catch (JSONException e) {
			throw new LppOptionException("Malformed chemical synonym table " + path + ": " + e.getMessage(), e);
		}
	}

	/**
	 * @return a resolver over the synonym table bundled with the compiler
	 */
	public static JsonChemicalResolver bundled() throws LppOptionException {
		try (InputStream in = JsonChemicalResolver.class.getResourceAsStream(DEFAULT_TABLE)) {
			if (in == null) {
				throw new LppOptionException("Bundled chemical synonym table " + DEFAULT_TABLE + " not found");
			}
			return new JsonChemicalResolver(new JSONObject(IOUtils.toString(in, StandardCharsets.UTF_8)));
		} catch (IOException e) {
			throw new LppOptionException("Cannot read bundled chemical synonym table", e);
		}
	}

	@Override
	public ChemicalResolution resolve(String name) {
		ChemicalResolution resolution = synonyms.get(name.toUpperCase(Locale.ROOT));
		if (resolution == null) {
			logger.fine("No synonym for " + name + ", keeping it as written");
			return ChemicalResolution.canonical();
		}
		return resolution;
	}

	public int size() {
		return synonyms.size();
	}
}
