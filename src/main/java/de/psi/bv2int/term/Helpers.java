package de.psi.bv2int.term;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.Vector;

public class Helpers {

	public static BigInteger pow2(int k) {
		if (k < 0) throw new AssertionError("negative exponent " + k);
		return BigInteger.ONE.shiftLeft(k);
	}

	/** Largest unsigned value of width k, i.e. 2^k - 1. */
	public static BigInteger maxUnsigned(int k) {
		return pow2(k).subtract(BigInteger.ONE);
	}

	/** Integer division of SMT-LIB (euclidean), total with {@code x div 0 = 0}. */
	public static BigInteger divTotal(BigInteger a, BigInteger b) {
		if (b.signum() == 0) return BigInteger.ZERO;
		BigInteger r = a.mod(b.abs());
		return a.subtract(r).divide(b);
	}

	/** Integer modulus of SMT-LIB (euclidean), total with {@code x mod 0 = x}. */
	public static BigInteger modTotal(BigInteger a, BigInteger b) {
		if (b.signum() == 0) return a;
		return a.mod(b.abs());
	}

	/** Two's complement reading of an unsigned value of width k. */
	public static BigInteger toSigned(BigInteger value, int k) {
		return value.testBit(k - 1) ? value.subtract(pow2(k)) : value;
	}

	/**
	 * Collects the free symbols (variables and applied function symbols) of
	 * the given terms, in the order they are first reached.
	 */
	public static Set<Term> collectSymbols(Iterable<Term> roots) {
		Set<Term> result = new LinkedHashSet<Term>();
		Set<Term> visited = new HashSet<Term>();
		Vector<Term> toVisit = new Vector<Term>();
		for (Term root : roots) {
			toVisit.add(root);
			while (!toVisit.isEmpty()) {
				Term current = toVisit.remove(toVisit.size() - 1);
				if (!visited.add(current)) continue;
				if (current.kind == Kind.VARIABLE) {
					result.add(current);
				} else if (current.kind == Kind.APPLY_UF) {
					result.add(current.op);
				}
				for (int i = current.getNumChildren() - 1; i >= 0; --i) {
					toVisit.add(current.get(i));
				}
			}
		}
		return result;
	}

	public static boolean containsKind(Term root, Kind kind) {
		Set<Term> visited = new HashSet<Term>();
		Vector<Term> toVisit = new Vector<Term>();
		toVisit.add(root);
		while (!toVisit.isEmpty()) {
			Term current = toVisit.remove(toVisit.size() - 1);
			if (!visited.add(current)) continue;
			if (current.kind == kind) return true;
			toVisit.addAll(current.children);
		}
		return false;
	}

}
