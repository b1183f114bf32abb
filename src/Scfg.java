import driver.*;

public class Scfg {
    /*
     * move the duty of the tool to driver,
     * for we can't use package here
     */
    public static void main(String[] args) {
        ScfgDriver driver = ScfgDriver.getInstance();
        driver.parseArgs(args);
        driver.run();
    }
}
