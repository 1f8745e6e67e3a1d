package fixtures;

public class Arithmetic {
    static final int LIMIT = 10 * 2;

    long scale(int a, long b) {
        return a * b;
    }

    boolean less(double x, double y) {
        return x < y;
    }

    int flip(int v) {
        return -v;
    }

    int offset() {
        return -5 + 0;
    }

    String label(int n) {
        return "n=" + n;
    }

    void bump(double[] d, int i) {
        d[i] += 0.5;
    }
}
