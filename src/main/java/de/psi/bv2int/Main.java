package de.psi.bv2int;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import de.psi.bv2int.preprocessing.Bv2IntOptions;
import edu.mit.csail.sdg.alloy4.Err;
import edu.mit.csail.sdg.alloy4.ErrorSyntax;

/**
 * Command line entry point:
 * {@code bv2int [--granularity=N] [--higher-order] [--logic=L] [file]}.
 * Reads standard input when no file is given and prints the translated script.
 */
public class Main {

	public static final String USAGE = "usage: bv2int [--granularity=N] [--higher-order] [--logic=L] [file]";

	/** Parsed command line. */
	static final class Arguments {
		final Bv2IntOptions options = new Bv2IntOptions();
		String file = null;
	}

	static Arguments parseArguments(String[] args) throws ErrorSyntax {
		Arguments a = new Arguments();
		for (String arg : args) {
			if (arg.startsWith("--granularity=")) {
				String value = arg.substring("--granularity=".length());
				int g;
				try {
					g = Integer.parseInt(value);
				} catch (NumberFormatException e) {
					throw new ErrorSyntax("Granularity must be a number but is " + value);
				}
				if (g < 0 || g > Bv2IntOptions.MAX_GRANULARITY)
					throw new ErrorSyntax("Granularity must be in [0, " + Bv2IntOptions.MAX_GRANULARITY + "] but is " + g);
				a.options.granularity = g;
			} else if (arg.equals("--higher-order")) {
				a.options.higherOrder = true;
			} else if (arg.startsWith("--logic=")) {
				a.options.logic = arg.substring("--logic=".length());
			} else if (arg.startsWith("--")) {
				throw new ErrorSyntax("Unknown option " + arg + "\n" + USAGE);
			} else if (a.file == null) {
				a.file = arg;
			} else {
				throw new ErrorSyntax("Only one input file is accepted\n" + USAGE);
			}
		}
		return a;
	}

	private static String readStdin() throws IOException {
		StringBuilder sb = new StringBuilder();
		BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		String line;
		while ((line = in.readLine()) != null) sb.append(line).append('\n');
		return sb.toString();
	}

	/** Runs the translation and returns the process exit code. */
	static int run(String[] args, PrintStream out, PrintStream err) {
		try {
			Arguments a = parseArguments(args);
			String document = a.file == null ? readStdin() : new String(Files.readAllBytes(Paths.get(a.file)), StandardCharsets.UTF_8);
			String name = a.file == null ? "<stdin>" : a.file;
			out.print(Bv2Int.execute(name, document, a.options));
			return 0;
		} catch (Err e) {
			err.println(e.toString());
			return 1;
		} catch (IOException e) {
			err.println("Cannot read input: " + e.getMessage());
			return 1;
		}
	}

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}
}
