package cloud.anchorwatch.sdk.role;

/**
 * Observer of role state changes. Notifications run on the client's event loop, one at a time and in the order
 * the transitions happened.
 */
@FunctionalInterface
public interface RoleTransitionListener {

    void onTransition(RoleTransition transition);
}
