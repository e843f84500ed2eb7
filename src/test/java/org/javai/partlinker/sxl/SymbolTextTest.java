package org.javai.partlinker.sxl;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SymbolText")
class SymbolTextTest {

	@Test
	@DisplayName("blocks differing only in whitespace are equivalent")
	void whitespaceOnly() {
		String rendered = "  (symbol \"A\"\n    (property \"Value\" \"1k\")\n  )";
		String onDisk = "(symbol \"A\" (property \"Value\" \"1k\") )";

		assertThat(SymbolText.equivalent(rendered, onDisk)).isTrue();
	}

	@Test
	@DisplayName("different values are not equivalent")
	void differentValues() {
		assertThat(SymbolText.equivalent("(symbol \"A\" (v \"1k\"))", "(symbol \"A\" (v \"2k\"))")).isFalse();
	}

	@Test
	@DisplayName("normalize collapses and trims")
	void normalize() {
		assertThat(SymbolText.normalize("\t(a\n\n b)  ")).isEqualTo("(a b)");
		assertThat(SymbolText.normalize(null)).isEmpty();
	}
}
