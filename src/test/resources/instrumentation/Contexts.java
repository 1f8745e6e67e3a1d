package fixtures;

public class Contexts {
    private volatile int[] shared = new int[4];

    void update(int[] data, int i) {
        data[i] = 1;
        data[i]++;
        int v = shared[i];
    }
}
