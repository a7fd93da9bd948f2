package categorizer.tree;

/**
* An abstraction representing the location of a single element within a
* tree. Two positions are equal if and only if they refer to the same node of
* the same tree.
*/
public interface Position<E> {

    /**
    * Returns the element stored at this position.
    *
    * @return the stored element.
    */
    E getElement();

}
