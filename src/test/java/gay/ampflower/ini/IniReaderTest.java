/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IniReaderTest {

	private static List<IniToken> tokens(String text) {
		return IniReader.tokenize(text, IniFormat.UNIVERSAL);
	}

	private static IniToken.KeyValue kv(String key, String value) {
		return new IniToken.KeyValue(key, value);
	}

	@Test
	void commentsAndBlankLines_skipped() {
		assertEquals(List.of(kv("key1", "value"), kv("key2", "other")),
				tokens("# comment\n\n   ; indented comment\nkey1 = value\n \t \nkey2=other\n"));
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
		"test = bar ; comment | bar ; comment",
		"test = bar # comment | bar # comment",
		"test =   spaced out   | spaced out",
		"test = a = b | a = b",
	})
	void unquotedValue_keptVerbatim(String line, String expected) {
		assertEquals(List.of(kv("test", expected)), tokens(line));
	}

	@Test
	void loneKey_isEmptyValue() {
		assertEquals(List.of(kv("empty", ""), kv("blank", "")), tokens("empty\nblank =   \n"));
	}

	@Test
	void quotedKey_stripsQuotes() {
		assertEquals(List.of(kv("quoted key", "VALUE 123"), kv("a=b", "c")),
				tokens("\"quoted key\"= VALUE 123\n\"a=b\" = c"));
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
		"[section]            | section     |",
		"[ various   ]        | various     |",
		"  [a b]              | a b         |",
		"[foo : def]          | foo         | def",
		"[foo:a.b]            | foo         | a.b",
		"[ foo  :  def ]  \t  | foo         | def",
		"[a : b : c]          | a           | b",
	})
	void sectionHeader(String line, String name, String inherits) {
		assertEquals(List.of(new IniToken.Section(name, inherits)), tokens(line));
	}

	@Test
	void multilineQuote_preservesInnerNewlines() {
		var text = "quote_multiline = \"\"\"\n  this is value\n\"\"\"\nafter = 1";
		assertEquals(List.of(kv("quote_multiline", "\n  this is value\n"), kv("after", "1")), tokens(text));
	}

	@Test
	void multilineQuote_onOneLine() {
		assertEquals(List.of(kv("k", "abc")), tokens("k = \"\"\"abc\"\"\"  "));
	}

	@Test
	void multilineQuote_keepsCommentsAndEscapesVerbatim() {
		var text = "k = \"\"\"first\n# not a comment\n[not a section]\nback\\nslash\"\"\"";
		assertEquals(List.of(kv("k", "first\n# not a comment\n[not a section]\nback\\nslash")), tokens(text));
	}

	@Test
	void quotedValue_processesEscapes() {
		assertEquals(List.of(kv("escape_sequences", "yay\nboo")), tokens("escape_sequences = \"yay\\nboo\""));
		assertEquals(List.of(kv("k", "tab\there \\ \"q\" \\x")), tokens("k = \"tab\\there \\\\ \\\"q\\\" \\x\""));
	}

	@Test
	void quotedValue_keepsSurroundingWhitespace() {
		assertEquals(List.of(kv("k", "  padded  ")), tokens("k = \"  padded  \"   "));
	}

	@Test
	void quotedValue_withoutEscapes() {
		var format = IniFormat.UNIVERSAL.without(IniFlag.PROCESS_ESCAPES);
		assertEquals(List.of(kv("path", "C:\\new")), IniReader.tokenize("path = \"C:\\new\"", format));
		assertEquals(List.of(kv("path", "C:\\Path")), IniReader.tokenize("path=C:\\Path", format));
	}

	@Test
	void lineContinuation_joinsWithSingleSpace() {
		assertEquals(List.of(kv("escaped_newlines", "abcd efg")), tokens("escaped_newlines = abcd \\\nefg"));
		assertEquals(List.of(kv("k", "a b c"), kv("next", "1")), tokens("k = a \\\n   b\\\n\t c\nnext = 1"));
	}

	@Test
	void lineContinuation_atEndOfText() {
		assertEquals(List.of(kv("k", "abcd")), tokens("k = abcd \\"));
	}

	@Test
	void lineContinuation_needsMarkerAtEndOfLine() {
		assertEquals(List.of(kv("k", "abcd \\"), kv("efg", "1")), tokens("k = abcd \\   \nefg = 1\n"));
		assertEquals(List.of(kv("k", "a b \\"), kv("c", "1")), tokens("k = a \\\nb \\  \nc = 1"));
	}

	@Test
	void lineContinuation_disabled() {
		var format = IniFormat.UNIVERSAL.without(IniFlag.LINE_CONTINUATION);
		assertEquals(List.of(kv("k", "abcd \\"), kv("efg", "")), IniReader.tokenize("k = abcd \\\nefg", format));
	}

	@Test
	void windowsLineEndings() {
		assertEquals(List.of(kv("a", "1"), new IniToken.Section("s"), kv("b", "2")),
				tokens("a = 1\r\n[s]\r\nb = 2\r\n"));
	}

	@Test
	void customFormat() {
		var format = new IniFormat("!", ":=", '\'', '\\', EnumSet.of(IniFlag.PROCESS_ESCAPES));
		assertEquals(List.of(kv("#name", "x"), kv("name", "it's"), kv("other", "y:z")),
				IniReader.tokenize("! comment\n#name = x\nname: 'it\\'s'\nother = y:z", format));
	}

	@Test
	void lineNumber_tracksTokenStart() {
		var reader = new IniReader("\n# comment\na = \"\"\"\n\n\"\"\"\n[s]\n");
		assertEquals(0, reader.getLineNumber());
		assertEquals(kv("a", "\n\n"), reader.next());
		assertEquals(3, reader.getLineNumber());
		assertEquals(new IniToken.Section("s"), reader.next());
		assertEquals(6, reader.getLineNumber());
		assertFalse(reader.hasNext());
		assertThrows(NoSuchElementException.class, reader::next);
	}

	@Test
	void reader_isLazy() {
		var reader = new IniReader("a = 1\n[bad");
		assertEquals(kv("a", "1"), reader.next());
		var e = assertThrows(IniSyntaxException.class, reader::hasNext);
		assertEquals(2, e.getLine());
		assertEquals("[bad", e.getText());
	}

	@Test
	void reader_stopsAtFirstError() {
		var reader = new IniReader("[bad\nk = v\n");
		var first = assertThrows(IniSyntaxException.class, reader::hasNext);
		assertSame(first, assertThrows(IniSyntaxException.class, reader::hasNext));
		assertSame(first, assertThrows(IniSyntaxException.class, reader::next));
		assertEquals(1, first.getLine());
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"[unterminated",
		"[a] trailing",
		"[]",
		"[  : def]",
		"[a : ]",
		"\"key = value",
		"\"key\" value",
		"= value",
		"k = \"open",
		"k = \"closed\" trailing",
		"k = \"\"\"closed\"\"\" trailing",
	})
	void malformedLine_throws(String line) {
		var e = assertThrows(IniSyntaxException.class, () -> tokens("ok = 1\n" + line + "\nafter = 2"));
		assertEquals(2, e.getLine());
		assertEquals(line, e.getText());
	}

	@Test
	void unterminatedMultiline_reportsOpeningLine() {
		var e = assertThrows(IniSyntaxException.class, () -> tokens("a = 1\nk = \"\"\"\nabc\n[s]\n"));
		assertEquals(2, e.getLine());
		assertEquals("k = \"\"\"", e.getText());
		assertTrue(e.getMessage().contains("multi-line"));
	}
}
