package fixtures;

public class GenericBox<T> {
    private T[] items;

    T first() {
        return items[0];
    }
}
