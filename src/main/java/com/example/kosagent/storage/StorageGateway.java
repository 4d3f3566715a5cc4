package com.example.kosagent.storage;

/**
 * 存储协作方入口，每次运行打开一个会话
 */
public interface StorageGateway {

    StorageSession openSession();
}
