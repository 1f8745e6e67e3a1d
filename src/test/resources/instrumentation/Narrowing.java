package fixtures;

public class Narrowing {
    static final int X = 1;
    static final char BASE = 'a';

    byte next() {
        byte b = X + 1;
        return b;
    }

    short negated() {
        short s = -X;
        return s;
    }

    char letter() {
        return BASE + 2;
    }

    Short boxed() {
        Short[] s = new Short[1];
        int i = 0;
        s[i] = 5;
        return s[0];
    }

    int sum(int[] v, int i) {
        byte[] table = {X + 2, 3};
        return v[i] + table[0];
    }
}
