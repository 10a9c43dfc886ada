package de.psi.bv2int;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.mit.csail.sdg.alloy4.ErrorSyntax;


public class MainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void parsesOptions() throws ErrorSyntax {
		Main.Arguments a = Main.parseArguments(new String[] { "--granularity=4", "--higher-order", "--logic=QF_NIA", "in.smt2" });
		assertEquals(4, a.options.granularity);
		assertTrue(a.options.higherOrder);
		assertEquals("QF_NIA", a.options.logic);
		assertEquals("in.smt2", a.file);

		Main.Arguments d = Main.parseArguments(new String[0]);
		assertEquals(1, d.options.granularity);
		assertNull(d.file);
	}

	private static void assertRejected(String... args) {
		try {
			Main.parseArguments(args);
			fail();
		} catch (ErrorSyntax e) {
			// expected
		}
	}

	@Test
	public void rejectsBadArguments() {
		assertRejected("--granularity=9");
		assertRejected("--granularity=-1");
		assertRejected("--granularity=many");
		assertRejected("--verbose");
		assertRejected("a.smt2", "b.smt2");
	}

	@Test
	public void translatesFile() throws IOException {
		File in = folder.newFile("in.smt2");
		Files.write(in.toPath(), "(declare-fun x () (_ BitVec 4)) (assert (bvult x #b0011)) (check-sat)".getBytes(StandardCharsets.UTF_8));
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		int code = Main.run(new String[] { in.getPath() }, new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8"));
		assertEquals(0, code);
		String text = out.toString("UTF-8");
		assertTrue(text, text.contains("(assert (< __bvToInt_var_0 3))"));
		assertTrue(text, text.endsWith("(check-sat)\n"));
	}

	@Test
	public void reportsErrors() throws IOException {
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		PrintStream errStream = new PrintStream(err, true, "UTF-8");
		PrintStream out = new PrintStream(new ByteArrayOutputStream(), true, "UTF-8");
		assertEquals(1, Main.run(new String[] { "--granularity=12" }, out, errStream));
		assertEquals(1, Main.run(new String[] { new File(folder.getRoot(), "missing.smt2").getPath() }, out, errStream));
		File bad = folder.newFile("bad.smt2");
		Files.write(bad.toPath(), "(assert (bvult x #b0011))".getBytes(StandardCharsets.UTF_8));
		assertEquals(1, Main.run(new String[] { bad.getPath() }, out, errStream));
		assertTrue(err.toString("UTF-8").contains("Unknown symbol x"));
	}
}
