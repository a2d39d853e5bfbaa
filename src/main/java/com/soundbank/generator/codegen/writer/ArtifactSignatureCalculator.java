package com.soundbank.generator.codegen.writer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import com.soundbank.generator.codegen.model.output.Artifact;

/**
 * Calculates a signature for an artifact's rendered structure. Two artifacts that would play
 * the same thing have the same signature, whatever their names and notes.
 */
public class ArtifactSignatureCalculator {

	private ArtifactSignatureCalculator() {
	}

	public static String calculateSignature(Artifact artifact) {
		StringBuilder sb = new StringBuilder();
		for (String line : artifact.getLines()) {
			sb.append(line).append('\n');
		}
		return hashString(sb.toString());
	}

	private static String hashString(String input) {
		try {
			MessageDigest md = MessageDigest.getInstance("SHA-256");
			byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
			return HexFormat.of().formatHex(hash);
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}
}
